package com.yoursp.relay.modules.integrity;

import com.yoursp.relay.modules.integrity.dto.IntegrityRunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs one integrity audit when the process is launched with
 * {@code --integrity-check}. Scheduling is left to an external timer
 * (cron, systemd timer, Kubernetes CronJob), which sees a non-zero exit
 * code when the run died with a fatal error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrityCheckRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String OPTION = "integrity-check";

    static final int EXIT_FAILED = 1;

    private final IntegrityAuditor auditor;

    private volatile IntegrityRunReport lastReport;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }

        IntegrityRunReport report = auditor.runAndPrune();
        lastReport = report;
        log.info("Integrity check finished: outcome={}, total={}, verified={}, failed={}",
                report.getOutcome(), report.getTotalFiles(), report.getVerifiedFiles(), report.getFailedFiles());
    }

    /**
     * Aborted runs (store unreachable) still exit 0; only a fatal error is reported as failure.
     */
    @Override
    public int getExitCode() {
        IntegrityRunReport report = lastReport;
        return report != null && report.getOutcome() == IntegrityRunReport.Outcome.FAILED ? EXIT_FAILED : 0;
    }
}
