package com.opsrunner.app.config;

import com.opsrunner.core.model.RetryPolicy;
import com.opsrunner.engine.config.UploadSettings;
import com.opsrunner.engine.config.WorkflowSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Runner configuration bound from {@code runner.*}.
 *
 * Sources, lowest precedence first: the packaged {@code application.yml},
 * the file given with {@code --config}, environment variables
 * ({@code RUNNER_WORKFLOW_MAX_CONCURRENT_WORKFLOWS=8}), command-line properties.
 */
@ConfigurationProperties(prefix = "runner")
public class RunnerProperties {

    private final WorkflowProperties workflow = new WorkflowProperties();
    private final UploadProperties upload = new UploadProperties();
    private final SystemProperties system = new SystemProperties();

    public WorkflowProperties getWorkflow() {
        return workflow;
    }

    public UploadProperties getUpload() {
        return upload;
    }

    public SystemProperties getSystem() {
        return system;
    }

    public static class WorkflowProperties {

        private Path workflowDir = Path.of("./workflows");
        private int maxConcurrentWorkflows = 4;

        /**
         * Per-step timeout. Bare numbers are seconds.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofSeconds(3600);

        private int retryAttempts = 3;

        /**
         * Wait before retry n is backoff-unit * 2^n.
         */
        private Duration backoffUnit = RetryPolicy.DEFAULT_BACKOFF_UNIT;

        /**
         * Upper bound for a single backoff wait; unbounded when unset.
         */
        private Duration backoffCap;

        public WorkflowSettings toSettings() {
            return new WorkflowSettings(workflowDir, maxConcurrentWorkflows, timeout,
                new RetryPolicy(retryAttempts, backoffUnit, backoffCap));
        }

        public Path getWorkflowDir() {
            return workflowDir;
        }

        public void setWorkflowDir(Path workflowDir) {
            this.workflowDir = workflowDir;
        }

        public int getMaxConcurrentWorkflows() {
            return maxConcurrentWorkflows;
        }

        public void setMaxConcurrentWorkflows(int maxConcurrentWorkflows) {
            this.maxConcurrentWorkflows = maxConcurrentWorkflows;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public Duration getBackoffUnit() {
            return backoffUnit;
        }

        public void setBackoffUnit(Duration backoffUnit) {
            this.backoffUnit = backoffUnit;
        }

        public Duration getBackoffCap() {
            return backoffCap;
        }

        public void setBackoffCap(Duration backoffCap) {
            this.backoffCap = backoffCap;
        }
    }

    public static class UploadProperties {

        private Path uploadDir = Path.of("./uploads");

        @DataSizeUnit(DataUnit.BYTES)
        private DataSize maxFileSize = DataSize.ofMegabytes(100);

        private List<String> allowedExtensions = new ArrayList<>(UploadSettings.DEFAULT_EXTENSIONS);
        private boolean compressionEnabled = true;
        private boolean backupEnabled = true;
        private Path backupDir = Path.of("./backups");

        /**
         * Admit uploads through the workflow limiter instead of a limiter of their own.
         */
        private boolean sharedLimiter = true;

        private int maxConcurrentUploads = 4;

        public UploadSettings toSettings() {
            return new UploadSettings(uploadDir, maxFileSize.toBytes(), allowedExtensions,
                compressionEnabled, backupEnabled, backupDir, sharedLimiter, maxConcurrentUploads);
        }

        public Path getUploadDir() {
            return uploadDir;
        }

        public void setUploadDir(Path uploadDir) {
            this.uploadDir = uploadDir;
        }

        public DataSize getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(DataSize maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public List<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }

        public boolean isCompressionEnabled() {
            return compressionEnabled;
        }

        public void setCompressionEnabled(boolean compressionEnabled) {
            this.compressionEnabled = compressionEnabled;
        }

        public boolean isBackupEnabled() {
            return backupEnabled;
        }

        public void setBackupEnabled(boolean backupEnabled) {
            this.backupEnabled = backupEnabled;
        }

        public Path getBackupDir() {
            return backupDir;
        }

        public void setBackupDir(Path backupDir) {
            this.backupDir = backupDir;
        }

        public boolean isSharedLimiter() {
            return sharedLimiter;
        }

        public void setSharedLimiter(boolean sharedLimiter) {
            this.sharedLimiter = sharedLimiter;
        }

        public int getMaxConcurrentUploads() {
            return maxConcurrentUploads;
        }

        public void setMaxConcurrentUploads(int maxConcurrentUploads) {
            this.maxConcurrentUploads = maxConcurrentUploads;
        }
    }

    public static class SystemProperties {

        private Path tempDir = Path.of("./temp");
        private Path cacheDir = Path.of("./cache");

        /**
         * Period of the background sweep that drops finished tasks from the registry.
         */
        private Duration cleanupInterval = Duration.ofHours(1);

        public Path getTempDir() {
            return tempDir;
        }

        public void setTempDir(Path tempDir) {
            this.tempDir = tempDir;
        }

        public Path getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }
}
