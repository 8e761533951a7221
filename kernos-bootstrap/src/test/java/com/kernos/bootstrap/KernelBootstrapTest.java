package com.kernos.bootstrap;

import com.kernos.config.KernelConfig;
import com.kernos.kernel.Actions;
import com.kernos.kernel.Address;
import com.kernos.kernel.Kernel;
import com.kernos.kernel.KernelModuleNotInstalledException;
import com.kernos.kernel.Module;
import com.kernos.kernel.Policy;
import com.kernos.keycode.Keycode;
import com.kernos.ledger.JsonLinesLedgerStore;
import com.kernos.ledger.LedgerRecord;
import com.kernos.ledger.NoOpLedgerStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KernelBootstrapTest {

    @TempDir
    Path tempDir;

    @Test
    void initialize_discoversProvidersAndWiresListeners() {
        KernelConfig config = KernelConfig.builder().executorLabel("ops").build();

        BootstrapContext ctx = KernelBootstrap.initialize(config);

        Kernel kernel = ctx.getKernel();
        assertEquals("ops", ctx.getExecutor().getLabel());
        assertEquals(ctx.getExecutor(), kernel.getExecutor());
        assertEquals(List.of(VaultModule.KEYCODE), kernel.getAllKeycodes());
        assertEquals(1, ctx.getPolicies().size());
        KeeperPolicy keeper = (KeeperPolicy) ctx.getPolicies().get(0);
        assertTrue(keeper.isActive());
        keeper.lockVault();
        assertTrue(((VaultModule) ctx.getModules().get(0)).locked);

        assertInstanceOf(NoOpLedgerStore.class, ctx.getLedger().orElseThrow().getStore());
        assertEquals(1.0, ctx.getMeterRegistry().orElseThrow()
                .get("kernos.kernel.permissions.granted").gauge().value());
    }

    @Test
    void initialize_withoutDiscoveryInstallsNothing() {
        KernelConfig config = KernelConfig.builder()
                .discoverProviders(false)
                .ledgerEnabled(false)
                .metricsEnabled(false)
                .build();

        BootstrapContext ctx = KernelBootstrap.initialize(config);

        assertTrue(ctx.getKernel().getAllKeycodes().isEmpty());
        assertTrue(ctx.getLedger().isEmpty());
        assertTrue(ctx.getMeterRegistry().isEmpty());
    }

    @Test
    void initialize_writesLedgerFileWhenConfigured() {
        Path file = tempDir.resolve("kernel.jsonl");
        KernelConfig config = KernelConfig.builder().ledgerFile(file).metricsEnabled(false).build();

        BootstrapContext ctx = KernelBootstrap.initialize(config,
                List.of(new VaultModuleProvider()), List.of(new KeeperPolicyProvider()));

        JsonLinesLedgerStore store = (JsonLinesLedgerStore) ctx.getLedger().orElseThrow().getStore();
        List<String> types = store.readAll().stream().map(LedgerRecord::getType).toList();
        assertEquals(List.of("MODULE_INSTALLED", "ACTION_EXECUTED",
                "PERMISSION_GRANTED", "POLICY_ACTIVATED", "ACTION_EXECUTED"), types);
    }

    @Test
    void initialize_skipsDisabledProviders() {
        ModuleProvider disabled = new ModuleProvider() {
            @Override
            public String getName() {
                return "disabled";
            }

            @Override
            public Module createModule(Kernel kernel) {
                throw new AssertionError("disabled provider must not be called");
            }

            @Override
            public boolean isEnabled() {
                return false;
            }
        };
        KernelConfig config = KernelConfig.builder().ledgerEnabled(false).metricsEnabled(false).build();

        BootstrapContext ctx = KernelBootstrap.initialize(config,
                List.of(disabled, new VaultModuleProvider()), List.of());

        assertEquals(List.of(VaultModule.KEYCODE), ctx.getKernel().getAllKeycodes());
        assertEquals(1, ctx.getModules().size());
    }

    @Test
    void initialize_policyWithoutItsModuleFailsWholeBatch() {
        KernelConfig config = KernelConfig.builder().ledgerEnabled(false).metricsEnabled(false).build();
        PolicyProvider orphan = new PolicyProvider() {
            @Override
            public String getName() {
                return "orphan";
            }

            @Override
            public Policy createPolicy(Kernel kernel) {
                return new KeeperPolicy(kernel) {
                    @Override
                    protected List<Keycode> configureDependencies() {
                        return List.of(Keycode.of("ABSNT"));
                    }
                };
            }
        };

        assertThrows(KernelModuleNotInstalledException.class, () -> KernelBootstrap.initialize(config,
                List.of(new VaultModuleProvider()), List.of(new KeeperPolicyProvider(), orphan)));
    }

    @Test
    void executorFromContextAdministersKernel() {
        KernelConfig config = KernelConfig.builder().ledgerEnabled(false).metricsEnabled(false).build();
        BootstrapContext ctx = KernelBootstrap.initialize(config, List.of(new VaultModuleProvider()), List.of());
        Address governance = Address.create("governance");

        ctx.getKernel().executeAction(ctx.getExecutor(), Actions.CHANGE_EXECUTOR, governance);

        assertEquals(governance, ctx.getKernel().getExecutor());
        assertFalse(ctx.getKernel().isRetired());
    }
}
