package com.javacpi.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.javacpi.normalize.JsonDecoder;
import com.javacpi.normalize.Normalizers;
import com.javacpi.normalize.OutputNormalizer;
import com.javacpi.normalize.ScalarDecoder;
import com.javacpi.normalize.VhdFormat;
import com.javacpi.normalize.VmState;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ActionName;
import com.javacpi.schema.ParamKind;
import com.javacpi.schema.ParameterSpec;
import com.javacpi.script.ScriptTemplate;
import com.javacpi.shared.error.MalformedOutputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.javacpi.script.ScriptTemplate.nonFatal;

/**
 * The Hyper-V action catalog: schema, PowerShell script and output normalizer per action.
 */
public final class HyperVActions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ParameterSpec WORKER_NAME =
            ParameterSpec.required("worker_name", "Name of the VM", ParamKind.STRING);
    private static final ParameterSpec DISK_PATH =
            ParameterSpec.required("disk_path", "Path to the disk", ParamKind.STRING);
    private static final ParameterSpec SNAPSHOT_NAME =
            ParameterSpec.required("snapshot_name", "Name of the snapshot", ParamKind.STRING);
    private static final ParameterSpec CONTROLLER_TYPE =
            ParameterSpec.optional("controller_type", "Type of controller (IDE, SCSI, DVD)", ParamKind.STRING, "SCSI");

    private static final String STATE_AS_CODE = "@{Name='State';Expression={[int]$_.State}}";
    private static final String SELECT_WORKER = "Get-VM | Where-Object { $_.Name -eq {{worker_name}} }";
    private static final String COUNT = "Measure-Object | Select-Object -ExpandProperty Count";

    // Cmdlet -Name/-VMName parameters expand wildcards, so a target VM is resolved by exact
    // name into $vm first and handed over with -VM.
    private static final List<String> RESOLVE_WORKER = List.of(
            "$vm = @(" + SELECT_WORKER + ")",
            "if ($vm.Count -eq 0) { throw ('VM not found: ' + {{worker_name}}) }",
            "if ($vm.Count -gt 1) { throw ('More than one VM is named ' + {{worker_name}}) }",
            "$vm = $vm[0]");

    private HyperVActions() {}

    public static ActionCatalog catalog() {
        return catalog(Map.of());
    }

    /**
     * @param defaults overrides for optional parameter defaults, keyed by parameter name
     */
    public static ActionCatalog catalog(Map<String, Object> defaults) {
        var catalog = new ActionCatalog();
        for (var entry : entries()) {
            var definition = entry.definition().withDefaults(defaults);
            catalog.register(new ActionEntry(definition, entry.script(), entry.normalizer(), entry.presenceCheck()));
        }
        return catalog;
    }

    private static List<ActionEntry> entries() {
        return List.of(
            testInstall(),
            listWorkers(),
            createWorker(),
            new ActionEntry(
                ActionDefinition.of(ActionName.DELETE_WORKER, "Delete a virtual machine",
                    ParameterSpec.required("worker_name", "Name of the VM to delete", ParamKind.STRING)),
                onWorker(
                    nonFatal("Stop-VM -VM $vm -TurnOff -Force"),
                    "Remove-VM -VM $vm -Force"),
                Normalizers.sideEffect()),
            getWorker(),
            new ActionEntry(
                ActionDefinition.of(ActionName.HAS_WORKER, "Check if a virtual machine exists", WORKER_NAME),
                ScriptTemplate.of(SELECT_WORKER + " | " + COUNT),
                Normalizers.existsByCount()),
            new ActionEntry(
                ActionDefinition.of(ActionName.START_WORKER, "Start a virtual machine",
                    ParameterSpec.required("worker_name", "Name of the VM to start", ParamKind.STRING)),
                onWorker("Start-VM -VM $vm"),
                Normalizers.sideEffect((payload, ignored, args) ->
                    payload.put("started", args.string("worker_name")))),
            getVolumes(),
            new ActionEntry(
                ActionDefinition.of(ActionName.HAS_VOLUME, "Check if a disk volume exists", DISK_PATH),
                ScriptTemplate.of("Test-Path -LiteralPath {{disk_path}} -PathType Leaf"),
                Normalizers.existsByBoolean()),
            new ActionEntry(
                ActionDefinition.of(ActionName.CREATE_VOLUME, "Create a new disk volume",
                    ParameterSpec.required("disk_path", "Path for the new disk", ParamKind.STRING),
                    ParameterSpec.required("size_mb", "Size in MB", ParamKind.INTEGER)),
                ScriptTemplate.of(
                    "New-VHD -Path {{disk_path}} -SizeBytes ({{size_mb}} * 1MB) -Dynamic | Out-Null",
                    "Get-VHD -Path {{disk_path}} | Select-Object Path | ConvertTo-Json"),
                diskPathResult("disk_path")),
            new ActionEntry(
                ActionDefinition.of(ActionName.DELETE_VOLUME, "Delete a disk volume", DISK_PATH),
                ScriptTemplate.of("Remove-Item -LiteralPath {{disk_path}} -Force"),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.ATTACH_VOLUME, "Attach a disk to a VM",
                    WORKER_NAME, CONTROLLER_TYPE, DISK_PATH),
                ScriptTemplate.byChoice("controller_type", Map.of(
                        "ide", onWorker("Add-VMHardDiskDrive -VM $vm -Path {{disk_path}} -ControllerType IDE"),
                        "dvd", onWorker("Add-VMDvdDrive -VM $vm -Path {{disk_path}}")),
                    onWorker("Add-VMHardDiskDrive -VM $vm -Path {{disk_path}} -ControllerType SCSI")),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.DETACH_VOLUME, "Detach a disk from a VM",
                    WORKER_NAME, CONTROLLER_TYPE, DISK_PATH),
                ScriptTemplate.byChoice("controller_type", Map.of(
                        "dvd", onWorker(
                            "$drive = Get-VMDvdDrive -VM $vm | Where-Object { $_.Path -eq {{disk_path}} }",
                            "if ($drive) { Remove-VMDvdDrive -VMDvdDrive $drive }")),
                    onWorker(
                        "$drive = Get-VMHardDiskDrive -VM $vm | Where-Object { $_.Path -eq {{disk_path}} }",
                        "if ($drive) { Remove-VMHardDiskDrive -VMHardDiskDrive $drive }")),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.CREATE_SNAPSHOT, "Create a snapshot of a VM", WORKER_NAME, SNAPSHOT_NAME),
                onWorker(
                    "Checkpoint-VM -VM $vm -SnapshotName {{snapshot_name}} -Passthru"
                        + " | Select-Object Id | ConvertTo-Json"),
                Normalizers.jsonObjectOrFallback(
                    (payload, snapshot, args) -> payload.put("id", JsonDecoder.text(snapshot, "Id", "unknown")),
                    (payload, ignored, args) -> payload.put("id",
                        args.string("worker_name") + "-" + args.string("snapshot_name")))),
            new ActionEntry(
                ActionDefinition.of(ActionName.DELETE_SNAPSHOT, "Delete a snapshot of a VM", WORKER_NAME, SNAPSHOT_NAME),
                onWorker(
                    "$snapshot = @(Get-VMSnapshot -VM $vm | Where-Object { $_.Name -eq {{snapshot_name}} })",
                    "if ($snapshot.Count -eq 0) { throw ('Snapshot not found: ' + {{snapshot_name}}) }",
                    "Remove-VMSnapshot -VMSnapshot $snapshot -IncludeAllChildSnapshots"),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.HAS_SNAPSHOT, "Check if a snapshot exists", WORKER_NAME, SNAPSHOT_NAME),
                ScriptTemplate.of(SELECT_WORKER + " | Get-VMSnapshot"
                    + " | Where-Object { $_.Name -eq {{snapshot_name}} } | " + COUNT),
                Normalizers.existsByCount()),
            new ActionEntry(
                ActionDefinition.of(ActionName.REBOOT_WORKER, "Reboot a VM", WORKER_NAME),
                onWorker("Restart-VM -VM $vm -Force"),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.CONFIGURE_NETWORKS, "Configure network settings for a VM",
                    WORKER_NAME,
                    ParameterSpec.required("switch_name", "Name of the virtual switch", ParamKind.STRING)),
                onWorker(
                    "Get-VMNetworkAdapter -VM $vm | Connect-VMNetworkAdapter -SwitchName {{switch_name}}"),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.SET_WORKER_METADATA, "Set metadata for a VM",
                    WORKER_NAME,
                    ParameterSpec.required("key", "Metadata key", ParamKind.STRING),
                    ParameterSpec.required("value", "Metadata value", ParamKind.STRING)),
                // Hyper-V has no metadata store; entries go to the VM notes, one key=value per line
                onWorker(
                    "$entry = {{key}} + '=' + {{value}}",
                    "$notes = if ($vm.Notes) { $vm.Notes + \"`n\" + $entry } else { $entry }",
                    "Set-VM -VM $vm -Notes $notes"),
                Normalizers.sideEffect()),
            new ActionEntry(
                ActionDefinition.of(ActionName.SNAPSHOT_VOLUME, "Clone a disk volume",
                    ParameterSpec.required("source_volume_path", "Path to the source disk", ParamKind.STRING),
                    ParameterSpec.required("target_volume_path", "Path for the cloned disk", ParamKind.STRING)),
                ScriptTemplate.of(
                    "New-VHD -ParentPath {{source_volume_path}} -Path {{target_volume_path}} -Differencing | Out-Null",
                    "Get-VHD -Path {{target_volume_path}} | Select-Object Path | ConvertTo-Json"),
                diskPathResult("target_volume_path"))
        );
    }

    private static ActionEntry testInstall() {
        return new ActionEntry(
            ActionDefinition.of(ActionName.TEST_INSTALL, "Test if Hyper-V is properly installed"),
            ScriptTemplate.of(
                "$PSVersionTable.PSVersion | Select-Object Major, Minor, Build, Patch | ConvertTo-Json -Compress",
                "Get-Command -Module Hyper-V | " + COUNT),
            Normalizers.composite((payload, stdout, args) -> {
                var lines = stdout.strip().lines().toList();
                if (lines.isEmpty() || !lines.get(0).contains("Major")) {
                    throw new MalformedOutputException("could not determine PowerShell version", stdout);
                }
                var version = JsonDecoder.object(lines.get(0));
                var cmdlets = ScalarDecoder.count(String.join("\n", lines.subList(1, lines.size())));
                payload.put("version", versionLabel(version));
                payload.put("hyperv_cmdlets", cmdlets);
                payload.put("hyperv_available", cmdlets > 0);
            }));
    }

    /** {@code statements} run after the VM named by {@code worker_name} is resolved into {@code $vm}. */
    private static ScriptTemplate onWorker(String... statements) {
        var all = new ArrayList<>(RESOLVE_WORKER);
        all.addAll(Arrays.asList(statements));
        return ScriptTemplate.of(all.toArray(String[]::new));
    }

    static String versionLabel(JsonNode version) {
        var label = JsonDecoder.integer(version, "Major", 0) + "." + JsonDecoder.integer(version, "Minor", 0);
        // Windows PowerShell reports Build, PowerShell 7 reports Patch
        var third = JsonDecoder.integer(version, "Build", -1);
        if (third < 0) third = JsonDecoder.integer(version, "Patch", -1);
        return third >= 0 ? label + "." + third : label;
    }

    private static ActionEntry listWorkers() {
        return new ActionEntry(
            ActionDefinition.of(ActionName.LIST_WORKERS, "List all virtual machines"),
            ScriptTemplate.of("Get-VM | Select-Object Name, Id, " + STATE_AS_CODE + " | ConvertTo-Csv -NoTypeInformation"),
            Normalizers.csv(List.of("name", "id", "state"), "workers", row -> MAPPER.createObjectNode()
                .put("name", row.get("name"))
                .put("id", row.get("id"))
                .put("state", VmState.fromText(row.get("state")).label())));
    }

    private static ActionEntry createWorker() {
        return new ActionEntry(
            ActionDefinition.of(ActionName.CREATE_WORKER, "Create a new virtual machine",
                ParameterSpec.required("worker_name", "Name of the VM to create", ParamKind.STRING),
                ParameterSpec.optional("memory_mb", "Memory in MB", ParamKind.INTEGER, 2048),
                ParameterSpec.optional("cpu_count", "Number of CPUs", ParamKind.INTEGER, 2),
                ParameterSpec.optional("generation", "VM generation (1 or 2)", ParamKind.INTEGER, 2),
                ParameterSpec.optional("switch_name", "Network switch to connect to", ParamKind.STRING, "Default Switch")),
            ScriptTemplate.of(
                "$vm = New-VM -Name {{worker_name}} -MemoryStartupBytes ({{memory_mb}} * 1MB) -Generation {{generation}}"
                    + " -SwitchName {{switch_name}}",
                "Set-VM -VM $vm -ProcessorCount {{cpu_count}}",
                "$vm | Select-Object Name, Id, " + STATE_AS_CODE + " | ConvertTo-Json"),
            Normalizers.jsonObject((payload, vm, args) -> payload
                .put("id", JsonDecoder.text(vm, "Id", "unknown"))
                .put("name", args.string("worker_name"))),
            new PresenceCheck(
                ScriptTemplate.of(SELECT_WORKER + " | " + COUNT),
                args -> "VM '" + args.string("worker_name") + "' already exists"));
    }

    private static ActionEntry getWorker() {
        return new ActionEntry(
            ActionDefinition.of(ActionName.GET_WORKER, "Get information about a virtual machine", WORKER_NAME),
            onWorker(
                "$vm | Select-Object Name, Id, " + STATE_AS_CODE + ", "
                    + "@{Name='memory_mb';Expression={[long]($_.MemoryStartup / 1MB)}}, "
                    + "@{Name='cpu_count';Expression={$_.ProcessorCount}}, "
                    + "@{Name='generation';Expression={$_.Generation}} | ConvertTo-Json"),
            Normalizers.jsonObject((payload, vm, args) -> payload.putObject("vm")
                .put("name", JsonDecoder.text(vm, "Name", "unknown"))
                .put("id", JsonDecoder.text(vm, "Id", "unknown"))
                .put("state", VmState.fromNode(vm.path("State")).label())
                .put("memory_mb", JsonDecoder.integer(vm, "memory_mb", 0))
                .put("cpu_count", JsonDecoder.integer(vm, "cpu_count", 0))
                .put("generation", JsonDecoder.integer(vm, "generation", 0))));
    }

    private static ActionEntry getVolumes() {
        return new ActionEntry(
            ActionDefinition.of(ActionName.GET_VOLUMES, "List all virtual disk volumes"),
            ScriptTemplate.of(
                "Get-VM | Get-VMHardDiskDrive | Where-Object { $_.Path } | Get-VHD"
                    + " | Select-Object Path, @{Name='VhdType';Expression={[int]$_.VhdType}}, Size | ConvertTo-Json"),
            Normalizers.jsonOneOrMany("volumes", HyperVActions::volume));
    }

    static JsonNode volume(JsonNode disk) {
        var path = JsonDecoder.text(disk, "Path", "unknown");
        return MAPPER.createObjectNode()
            .put("id", path)
            .put("path", path)
            .put("size_mb", JsonDecoder.integer(disk, "Size", 0) / (1024 * 1024))
            .put("format", VhdFormat.fromNode(disk.path("VhdType")).label());
    }

    private static OutputNormalizer diskPathResult(String pathParam) {
        return Normalizers.jsonObjectOrFallback(
            (payload, disk, args) -> {
                var path = JsonDecoder.text(disk, "Path", args.string(pathParam));
                payload.put("id", path).put("path", path);
            },
            (payload, ignored, args) -> payload
                .put("id", args.string(pathParam))
                .put("path", args.string(pathParam)));
    }
}
