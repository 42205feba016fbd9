package org.approvalkit.reporter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reporter used when none is configured: quiet on CI, otherwise the first installed diff tool.
 */
public final class DefaultReporter implements ApprovalFailureReporter {
    private final ApprovalFailureReporter delegate;

    public DefaultReporter() {
        this(System.getenv(), ProcessLauncher.system());
    }

    public DefaultReporter(Map<String, String> environment, ProcessLauncher launcher) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(launcher, "launcher");
        if (new CiEnvironment(environment).isCi()) {
            this.delegate = QuietReporter.INSTANCE;
            return;
        }
        List<ApprovalFailureReporter> tools = new ArrayList<>();
        for (DiffProgram program : DiffPrograms.all()) {
            tools.add(new DiffToolReporter(program, launcher, environment));
        }
        tools.add(QuietReporter.INSTANCE);
        this.delegate = new FirstWorkingReporter(tools);
    }

    ApprovalFailureReporter delegate() {
        return delegate;
    }

    @Override
    public boolean report(Path receivedFile, Path approvedFile) {
        return delegate.report(receivedFile, approvedFile);
    }

    @Override
    public String toString() {
        return "DefaultReporter[" + delegate + "]";
    }
}
