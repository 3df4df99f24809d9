package com.javacpi.observability;

import com.javacpi.exec.ToolExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

public class DoctorCommand {

    private final ToolExecutor executor;
    private final String executable;
    private final Path configPath;

    public DoctorCommand(ToolExecutor executor, String executable, Path configPath) {
        this.executor = executor;
        this.executable = executable;
        this.configPath = configPath;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkTool());
        results.add(checkHyperVModule());
        results.add(checkConfig());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkTool() {
        return executor.isAvailable()
                ? "[OK] PowerShell available (" + executable + ")"
                : "[FAIL] PowerShell not available (" + executable + ")";
    }

    private String checkHyperVModule() {
        try {
            var result = executor.execute("@(Get-Module -ListAvailable -Name Hyper-V).Count");
            if (!result.succeeded()) {
                return "[FAIL] Hyper-V module check: " + result.stderr().strip();
            }
            return result.stdout().strip().equals("0")
                    ? "[FAIL] Hyper-V PowerShell module not installed"
                    : "[OK] Hyper-V PowerShell module installed";
        } catch (RuntimeException e) {
            return "[FAIL] Hyper-V module check: " + e.getMessage();
        }
    }

    private String checkConfig() {
        return Files.isRegularFile(configPath)
                ? "[OK] Config file " + configPath
                : "[WARN] Config file " + configPath + " not found (using defaults)";
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
