package com.kernos.kernel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrateKernelTest {

    private Address executor;
    private Kernel kernel;
    private Kernel successor;
    private MockModule module;
    private MockPolicy policy;
    private MockPolicy dormant;

    @BeforeEach
    void setUp() {
        executor = Address.create("executor");
        kernel = new Kernel(executor);
        successor = new Kernel(executor);
        module = new MockModule(kernel);
        policy = new MockPolicy(kernel);
        dormant = new MockPolicy(kernel);
        kernel.executeInstructions(executor, List.of(
                Instruction.installModule(module),
                Instruction.activatePolicy(policy),
                Instruction.activatePolicy(dormant),
                Instruction.deactivatePolicy(dormant)));
    }

    @Test
    void migrate_movesTrustAndRetiresKernel() {
        Capability capability = policy.getCapability();
        RecordingListener listener = new RecordingListener();
        kernel.addListener(listener);

        kernel.executeAction(executor, Actions.MIGRATE_KERNEL, successor);

        assertSame(successor, module.getKernel());
        assertSame(successor, policy.getKernel());
        assertSame(kernel, dormant.getKernel());
        assertTrue(kernel.isRetired());
        assertSame(successor, kernel.getSuccessor().orElseThrow());
        assertEquals(List.of(
                KernelEventType.PERMISSION_REVOKED,
                KernelEventType.POLICY_DEACTIVATED,
                KernelEventType.KERNEL_MIGRATED,
                KernelEventType.ACTION_EXECUTED), listener.types());
        assertThrows(ModulePolicyNotPermittedException.class, () -> module.setValue(capability, 1));
    }

    @Test
    void migrate_retiredKernelReportsNoGrantsOrActivePolicies() {
        kernel.executeAction(executor, Actions.MIGRATE_KERNEL, successor);

        assertFalse(kernel.hasPermission(policy.getAddress(), MockModule.KEYCODE, MockModule.SET_VALUE));
        assertTrue(kernel.getPermissions(policy.getAddress()).isEmpty());
        assertEquals(0, kernel.getPermissionCount());
        assertFalse(kernel.isPolicyActive(policy.getAddress()));
        assertTrue(kernel.getActivePolicies().isEmpty());
        assertTrue(kernel.getModuleDependents(MockModule.KEYCODE).isEmpty());
        assertFalse(kernel.getPolicyRecord(policy.getAddress()).orElseThrow().active());
    }

    @Test
    void retiredKernelRejectsFurtherActions() {
        kernel.executeAction(executor, Actions.MIGRATE_KERNEL, successor);

        KernelRetiredException e = assertThrows(KernelRetiredException.class,
                () -> kernel.executeAction(executor, Actions.CHANGE_EXECUTOR, Address.create("next")));

        assertEquals(kernel.getAddress(), e.getKernel());
        assertEquals(successor.getAddress(), e.getSuccessor());
        assertEquals(executor, kernel.getExecutor());
    }

    @Test
    void successorCanRegisterMigratedAdapters() {
        kernel.executeAction(executor, Actions.MIGRATE_KERNEL, successor);

        successor.executeInstructions(executor, List.of(
                Instruction.installModule(module),
                Instruction.activatePolicy(policy)));

        assertEquals(2, module.initCount);
        policy.setModuleValue(99);
        assertEquals(99, module.value);
        assertTrue(successor.hasPermission(policy.getAddress(), MockModule.KEYCODE, MockModule.SET_VALUE));
    }

    @Test
    void migrate_rejectsSelfAndRetiredTarget() {
        assertThrows(KernelInvalidTargetException.class,
                () -> kernel.executeAction(executor, Actions.MIGRATE_KERNEL, kernel));

        Kernel retired = new Kernel(executor);
        retired.executeAction(executor, Actions.MIGRATE_KERNEL, new Kernel(executor));
        assertThrows(KernelInvalidTargetException.class,
                () -> kernel.executeAction(executor, Actions.MIGRATE_KERNEL, retired));

        assertFalse(kernel.isRetired());
        assertSame(kernel, module.getKernel());
    }

    @Test
    void failedBatchRestoresTrustedKernels() {
        assertThrows(KernelRetiredException.class, () -> kernel.executeInstructions(executor, List.of(
                Instruction.migrateKernel(successor),
                Instruction.changeExecutor(Address.create("next")))));

        assertFalse(kernel.isRetired());
        assertSame(kernel, module.getKernel());
        assertSame(kernel, policy.getKernel());
        assertTrue(kernel.isPolicyActive(policy.getAddress()));
        assertTrue(kernel.hasPermission(policy.getAddress(), MockModule.KEYCODE, MockModule.SET_VALUE));
        policy.setModuleValue(5);
        assertEquals(5, module.value);
    }
}
