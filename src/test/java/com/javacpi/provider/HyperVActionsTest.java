package com.javacpi.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.javacpi.normalize.Normalizers;
import com.javacpi.observability.MetricsConfig;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ActionName;
import com.javacpi.schema.ParameterValidator;
import com.javacpi.schema.ValidatedArguments;
import com.javacpi.script.ScriptTemplate;
import com.javacpi.shared.config.LookupFailurePolicy;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HyperVActionsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ValidatedArguments sampleArgs(ActionDefinition definition) {
        var input = new HashMap<String, Object>();
        for (var p : definition.parameters()) {
            switch (p.kind()) {
                case STRING -> input.put(p.name(), "sample");
                case INTEGER -> input.put(p.name(), 10L);
                case BOOLEAN -> input.put(p.name(), true);
            }
        }
        return new ParameterValidator().validate(definition, input);
    }

    @Test
    void catalogHasEveryActionInOrder() {
        var catalog = HyperVActions.catalog();
        assertThat(catalog.names()).containsExactly(ActionName.values());
    }

    @Test
    void everyScriptRendersWithoutLeftoverPlaceholders() {
        for (var entry : HyperVActions.catalog().all()) {
            var args = sampleArgs(entry.definition());
            var script = entry.script().render(args);

            assertThat(script).as(entry.definition().name().id()).isNotBlank().doesNotContain("{{");
            entry.presence().ifPresent(check ->
                    assertThat(check.countScript().render(args)).doesNotContain("{{"));
        }
    }

    @Test
    void onlyCreateWorkerHasPresenceCheck() {
        var catalog = HyperVActions.catalog();
        for (var entry : catalog.all()) {
            assertThat(entry.presence().isPresent())
                    .as(entry.definition().name().id())
                    .isEqualTo(entry.definition().name() == ActionName.CREATE_WORKER);
        }
    }

    @Test
    void configuredDefaultsReplaceBuiltIns() {
        var catalog = HyperVActions.catalog(Map.of("memory_mb", 4096, "switch_name", "External"));
        var definition = catalog.get(ActionName.CREATE_WORKER).definition();

        assertThat(definition.parameter("memory_mb").orElseThrow().defaultValue()).isEqualTo(4096L);
        assertThat(definition.parameter("switch_name").orElseThrow().defaultValue()).isEqualTo("External");
        assertThat(definition.parameter("cpu_count").orElseThrow().defaultValue()).isEqualTo(2L);
    }

    @Test
    void attachVolumePicksDriveByControllerType() {
        var entry = HyperVActions.catalog().get(ActionName.ATTACH_VOLUME);
        var validator = new ParameterValidator();

        var scsi = entry.script().render(validator.validate(entry.definition(),
                Map.of("worker_name", "web", "disk_path", "D:\\a.vhdx")));
        var ide = entry.script().render(validator.validate(entry.definition(),
                Map.of("worker_name", "web", "disk_path", "D:\\a.vhdx", "controller_type", "IDE")));
        var dvd = entry.script().render(validator.validate(entry.definition(),
                Map.of("worker_name", "web", "disk_path", "D:\\os.iso", "controller_type", "dvd")));

        assertThat(scsi).contains("Add-VMHardDiskDrive").contains("-ControllerType SCSI");
        assertThat(ide).contains("-ControllerType IDE");
        assertThat(dvd).contains("Add-VMDvdDrive -VM $vm -Path 'D:\\os.iso'").doesNotContain("Add-VMHardDiskDrive");
    }

    @Test
    void deleteWorkerStopsBeforeRemoving() {
        var entry = HyperVActions.catalog().get(ActionName.DELETE_WORKER);
        var script = entry.script().render(new ValidatedArguments(Map.of("worker_name", "web")));

        assertThat(script).isEqualTo(
                "$vm = @(Get-VM | Where-Object { $_.Name -eq 'web' }); "
                        + "if ($vm.Count -eq 0) { throw ('VM not found: ' + 'web') }; "
                        + "if ($vm.Count -gt 1) { throw ('More than one VM is named ' + 'web') }; "
                        + "$vm = $vm[0]; "
                        + "try { Stop-VM -VM $vm -TurnOff -Force } catch { $null = $_ }; Remove-VM -VM $vm -Force");
    }

    @Test
    void wildcardNamesNeverReachNameParameters() {
        var catalog = HyperVActions.catalog();
        for (var name : catalog.names()) {
            // New-VM takes its -Name literally
            if (name == ActionName.CREATE_WORKER) continue;
            var entry = catalog.get(name);
            var input = new HashMap<String, Object>();
            for (var p : entry.definition().parameters()) {
                switch (p.kind()) {
                    case STRING -> input.put(p.name(), "*");
                    case INTEGER -> input.put(p.name(), 10L);
                    case BOOLEAN -> input.put(p.name(), true);
                }
            }
            var script = entry.script().render(new ParameterValidator().validate(entry.definition(), input));

            assertThat(script).as(name.id())
                    .doesNotContain("-VMName '*'")
                    .doesNotContain("-Name '*'");
        }
    }

    @Test
    void snapshotIsResolvedByExactName() {
        var entry = HyperVActions.catalog().get(ActionName.DELETE_SNAPSHOT);
        var script = entry.script().render(new ValidatedArguments(Map.of("worker_name", "*", "snapshot_name", "*")));

        assertThat(script)
                .contains("$_.Name -eq '*'")
                .contains("throw ('Snapshot not found: ' + '*')")
                .endsWith("Remove-VMSnapshot -VMSnapshot $snapshot -IncludeAllChildSnapshots");
    }

    @Test
    void versionLabelHandlesBothEditions() throws Exception {
        var desktop = MAPPER.readTree("{\"Major\":5,\"Minor\":1,\"Build\":19041,\"Patch\":null}");
        var core = MAPPER.readTree("{\"Major\":7,\"Minor\":4,\"Build\":null,\"Patch\":2}");

        assertThat(HyperVActions.versionLabel(desktop)).isEqualTo("5.1.19041");
        assertThat(HyperVActions.versionLabel(core)).isEqualTo("7.4.2");
    }

    @Test
    void volumeConvertsSizeAndFormat() throws Exception {
        var disk = MAPPER.readTree("{\"Path\":\"D:\\\\b.vhdx\",\"VhdType\":4,\"Size\":1073741824}");

        var volume = HyperVActions.volume(disk);

        assertThat(volume.path("id").asText()).isEqualTo("D:\\b.vhdx");
        assertThat(volume.path("size_mb").asLong()).isEqualTo(1024L);
        assertThat(volume.path("format").asText()).isEqualTo("Differencing");
    }

    @Test
    void testInstallReportsVersionAndCmdlets() {
        var executor = new ScriptedExecutor()
                .reply("{\"Major\":5,\"Minor\":1,\"Build\":19041,\"Patch\":null}\r\n245\r\n")
                .reply("{\"Major\":7,\"Minor\":4,\"Build\":null,\"Patch\":1}\r\n0\r\n");
        var dispatcher = new ActionDispatcher(HyperVActions.catalog(), executor,
                LookupFailurePolicy.FAIL, new MetricsConfig());

        var installed = dispatcher.execute("test_install", Map.of()).payload();
        var missing = dispatcher.execute("test_install", Map.of()).payload();

        assertThat(installed.path("version").asText()).isEqualTo("5.1.19041");
        assertThat(installed.path("hyperv_cmdlets").asLong()).isEqualTo(245L);
        assertThat(installed.path("hyperv_available").asBoolean()).isTrue();
        assertThat(missing.path("hyperv_available").asBoolean()).isFalse();
    }

    @Test
    void createVolumeFallsBackToRequestedPath() {
        var executor = new ScriptedExecutor().reply("");
        var dispatcher = new ActionDispatcher(HyperVActions.catalog(), executor,
                LookupFailurePolicy.FAIL, new MetricsConfig());

        var result = dispatcher.execute("create_volume", Map.of("disk_path", "D:\\new.vhdx", "size_mb", 512));

        assertThat(result.isError()).isFalse();
        assertThat(result.payload().path("path").asText()).isEqualTo("D:\\new.vhdx");
        assertThat(executor.scripts.get(0)).contains("-SizeBytes (512 * 1MB) -Dynamic");
    }

    @Test
    void createSnapshotSynthesizesIdWhenOutputIsMissing() {
        var executor = new ScriptedExecutor().reply("{\"Id\":{\"Guid\":\"snap-1\"}}").reply("");
        var dispatcher = new ActionDispatcher(HyperVActions.catalog(), executor,
                LookupFailurePolicy.FAIL, new MetricsConfig());
        var params = Map.of("worker_name", "web", "snapshot_name", "before-upgrade");

        assertThat(dispatcher.execute("create_snapshot", params).payload().path("id").asText()).isEqualTo("snap-1");
        assertThat(dispatcher.execute("create_snapshot", params).payload().path("id").asText())
                .isEqualTo("web-before-upgrade");
    }

    @Test
    void entryRejectsUndeclaredPlaceholders() {
        var definition = ActionDefinition.of(ActionName.HAS_WORKER, "Check");

        assertThatThrownBy(() -> new ActionEntry(definition,
                ScriptTemplate.of("Get-VM -Name {{worker_name}}"), Normalizers.existsByCount()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("worker_name");
    }

    @Test
    void catalogRejectsDuplicates() {
        var catalog = new ActionCatalog();
        var entry = HyperVActions.catalog().get(ActionName.HAS_WORKER);
        catalog.register(entry);

        assertThatThrownBy(() -> catalog.register(entry)).isInstanceOf(IllegalArgumentException.class);
        assertThat(catalog.find("has_worker")).isPresent();
        assertThat(catalog.find("list_workers")).isEmpty();
        assertThat(catalog.names()).isEqualTo(List.of(ActionName.HAS_WORKER));
    }
}
