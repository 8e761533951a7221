/**
 * Micrometer metrics for kernel activity.
 */
package com.kernos.features.metrics;
