package com.kernos.kernel;

import com.kernos.keycode.Keycode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleUpgradeTest {

    private Address executor;
    private Kernel kernel;
    private MockModule original;
    private MockPolicy first;
    private MockPolicy second;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        executor = Address.create("executor");
        kernel = new Kernel(executor);
        original = new MockModule(kernel);
        first = new MockPolicy(kernel);
        second = new MockPolicy(kernel);
        kernel.executeInstructions(executor, List.of(
                Instruction.installModule(original),
                Instruction.activatePolicy(first),
                Instruction.activatePolicy(second)));
        first.setModuleValue(10);
        listener = new RecordingListener();
        kernel.addListener(listener);
    }

    private MockModule nextVersion() {
        MockModule upgraded = new MockModule(kernel, MockModule.KEYCODE, Version.of(1, 1));
        upgraded.onInit = m -> m.value = original.value;
        return upgraded;
    }

    @Test
    void upgrade_keepsKeycodeAndMovesAddress() {
        MockModule upgraded = nextVersion();

        kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded);

        assertSame(upgraded, kernel.getModuleForKeycode(MockModule.KEYCODE).orElseThrow());
        assertNotEquals(original.getAddress(), upgraded.getAddress());
        assertEquals(Version.of(1, 1), kernel.getModuleRecord(MockModule.KEYCODE).orElseThrow().version());
        assertTrue(kernel.getKeycodeForModule(original).isEmpty());
        assertEquals(MockModule.KEYCODE, kernel.getKeycodeForModule(upgraded).orElseThrow());
        assertEquals(10, upgraded.value);

        KernelEvent event = listener.events.get(0);
        assertEquals(KernelEventType.MODULE_UPGRADED, event.type());
        assertEquals(upgraded.getAddress(), event.subject());
        assertEquals(original.getAddress(), event.previous());
    }

    @Test
    void upgrade_verifiesAndRefreshesEveryDependent() {
        MockModule upgraded = nextVersion();

        kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded);

        assertEquals(1, first.verifyCount);
        assertEquals(1, second.verifyCount);
        assertEquals(2, first.configureCount);
        assertEquals(2, second.configureCount);
        assertSame(upgraded, first.module);
        assertSame(upgraded, second.module);
    }

    @Test
    void upgrade_permissionsFollowKeycodeAndStaleInstanceIsRejected() {
        Capability capability = first.getCapability();
        MockModule upgraded = nextVersion();

        kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded);

        first.setModuleValue(11);
        assertEquals(11, upgraded.value);
        assertSame(capability, first.getCapability());
        assertThrows(ModulePolicyNotPermittedException.class, () -> original.setValue(capability, 12));
        assertEquals(10, original.value);
    }

    @Test
    void upgrade_rejectsUninstalledKeycodeAndSameInstance() {
        assertThrows(KernelInvalidModuleUpgradeException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, original));

        MockModule unknown = new MockModule(kernel, Keycode.of("NOPEE"), Version.of(1, 0));
        assertThrows(KernelInvalidModuleUpgradeException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, unknown));
    }

    @Test
    void upgrade_vetoedInVerifyPhaseChangesNothing() {
        second.verifyFailure = new IllegalStateException("not compatible");
        MockModule upgraded = nextVersion();

        KernelRefreshFailedException e = assertThrows(KernelRefreshFailedException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded));

        assertEquals(KernelRefreshFailedException.Phase.VERIFY, e.getPhase());
        assertEquals(second.getAddress(), e.getPolicy());
        assertEquals(ErrorCategory.CONSISTENCY, e.getCategory());
        assertSame(original, kernel.getModuleForKeycode(MockModule.KEYCODE).orElseThrow());
        assertEquals(0, upgraded.initCount);
        assertEquals(1, first.configureCount);
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void upgrade_failedCommitRestoresRegistryAndCompensatesRefreshedDependents() {
        MockModule upgraded = nextVersion();
        second.configureFailure = new IllegalStateException("refresh failed");

        KernelRefreshFailedException e = assertThrows(KernelRefreshFailedException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded));

        assertEquals(KernelRefreshFailedException.Phase.COMMIT, e.getPhase());
        assertEquals(second.getAddress(), e.getPolicy());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertSame(original, kernel.getModuleForKeycode(MockModule.KEYCODE).orElseThrow());
        assertSame(original, first.module);
        assertEquals(1, e.getSuppressed().length);

        second.configureFailure = null;
        first.setModuleValue(20);
        assertEquals(20, original.value);
    }

    @Test
    void upgrade_refreshDeclaringUninstalledDependencyFails() {
        MockModule upgraded = nextVersion();
        first.dependencies = List.of(MockModule.KEYCODE, Keycode.of("GONEE"));

        KernelRefreshFailedException e = assertThrows(KernelRefreshFailedException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded));

        assertInstanceOf(KernelModuleNotInstalledException.class, e.getCause());
        assertSame(original, kernel.getModuleForKeycode(MockModule.KEYCODE).orElseThrow());
        assertEquals(List.of(MockModule.KEYCODE),
                kernel.getPolicyRecord(first.getAddress()).orElseThrow().dependencies());
    }

    @Test
    void upgrade_skipsInactivePolicies() {
        kernel.executeAction(executor, Actions.DEACTIVATE_POLICY, second);

        kernel.executeAction(executor, Actions.UPGRADE_MODULE, nextVersion());

        assertEquals(0, second.verifyCount);
        assertEquals(1, second.configureCount);
        assertEquals(1, first.verifyCount);
    }
}
