package com.kernos.kernel;

import com.kernos.keycode.Keycode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Treasury and custodian walk-through: install, grant, use, upgrade, revoke. */
class KernelScenarioTest {

    static final Keycode TRSRY = Keycode.of("TRSRY");

    static class Treasury extends Module {
        static final String WITHDRAW = "withdraw";

        private final Version version;
        final Map<String, Long> balances = new HashMap<>();

        Treasury(Kernel kernel, Version version) {
            super(kernel);
            this.version = version;
        }

        @Override
        public Keycode getKeycode() {
            return TRSRY;
        }

        @Override
        public Version getVersion() {
            return version;
        }

        long balanceOf(String account) {
            return balances.getOrDefault(account, 0L);
        }

        void withdraw(Capability caller, String account, long amount) {
            permissioned(caller, WITHDRAW);
            long balance = balanceOf(account);
            if (balance < amount) {
                throw new IllegalArgumentException("insufficient balance");
            }
            balances.put(account, balance - amount);
        }
    }

    static class Custodian extends Policy {
        Treasury treasury;

        Custodian(Kernel kernel) {
            super(kernel);
        }

        @Override
        protected List<Keycode> configureDependencies() {
            treasury = getModule(TRSRY, Treasury.class);
            requireMajorVersion(treasury, 1);
            return List.of(TRSRY);
        }

        @Override
        protected List<Permission> requestPermissions() {
            return List.of(Permission.of(TRSRY, Treasury.WITHDRAW));
        }

        void payOut(String account, long amount) {
            treasury.withdraw(getCapability(), account, amount);
        }
    }

    private Address executor;
    private Kernel kernel;
    private Treasury treasury;
    private Custodian custodian;

    @BeforeEach
    void setUp() {
        executor = Address.create("executor");
        kernel = new Kernel(executor);
        treasury = new Treasury(kernel, Version.of(1, 0));
        treasury.balances.put("ops", 100L);
        custodian = new Custodian(kernel);
        kernel.executeAction(executor, Actions.INSTALL_MODULE, treasury);
        kernel.executeAction(executor, Actions.ACTIVATE_POLICY, custodian);
    }

    @Test
    void onlyGrantedCustodianCanWithdraw() {
        custodian.payOut("ops", 30);
        assertEquals(70, treasury.balanceOf("ops"));

        Custodian unregistered = new Custodian(kernel);
        assertThrows(KernelPolicyNotActivatedException.class, unregistered::getCapability);
        assertThrows(ModulePolicyNotPermittedException.class, () -> treasury.withdraw(null, "ops", 1));
        assertEquals(70, treasury.balanceOf("ops"));
    }

    @Test
    void deactivationRemovesWithdrawGrant() {
        kernel.executeAction(executor, Actions.DEACTIVATE_POLICY, custodian);

        assertFalse(kernel.hasPermission(custodian.getAddress(), TRSRY, Treasury.WITHDRAW));
        assertThrows(KernelPolicyNotActivatedException.class, () -> custodian.payOut("ops", 1));
        assertEquals(100, treasury.balanceOf("ops"));
    }

    @Test
    void upgradedTreasuryServesExistingCustodian() {
        Treasury upgraded = new Treasury(kernel, Version.of(1, 1));
        upgraded.balances.putAll(treasury.balances);

        kernel.executeAction(executor, Actions.UPGRADE_MODULE, upgraded);

        assertSame(upgraded, custodian.treasury);
        custodian.payOut("ops", 40);
        assertEquals(60, upgraded.balanceOf("ops"));
        assertEquals(100, treasury.balanceOf("ops"));
        assertTrue(kernel.hasPermission(custodian.getAddress(), TRSRY, Treasury.WITHDRAW));
    }

    @Test
    void upgradeToIncompatibleMajorVersionIsRolledBack() {
        Treasury incompatible = new Treasury(kernel, Version.of(2, 0));

        KernelRefreshFailedException e = assertThrows(KernelRefreshFailedException.class,
                () -> kernel.executeAction(executor, Actions.UPGRADE_MODULE, incompatible));

        assertEquals(KernelRefreshFailedException.Phase.COMMIT, e.getPhase());
        assertTrue(e.getCause() instanceof PolicyWrongModuleVersionException);
        assertSame(treasury, kernel.getModuleForKeycode(TRSRY).orElseThrow());
        assertSame(treasury, custodian.treasury);
        custodian.payOut("ops", 10);
        assertEquals(90, treasury.balanceOf("ops"));
    }

    @Test
    void custodianCannotActivateWithoutTreasury() {
        Kernel empty = new Kernel(executor);
        Custodian early = new Custodian(empty);

        assertThrows(PolicyModuleDoesNotExistException.class,
                () -> empty.executeAction(executor, Actions.ACTIVATE_POLICY, early));
        assertFalse(early.isActive());
    }
}
