/**
 * Environment-driven settings for {@code kernos-bootstrap}: executor label, ledger and metrics switches.
 */
package com.kernos.config;
