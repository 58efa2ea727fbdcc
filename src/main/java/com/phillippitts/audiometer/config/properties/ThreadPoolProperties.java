package com.phillippitts.audiometer.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the recording writer pool and the metering scheduler. Recording threads spend
 * most of their time in file I/O; metering threads run one short FFT per session per tick.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private RecordingPoolProperties recording = new RecordingPoolProperties();
    private MeteringPoolProperties metering = new MeteringPoolProperties();

    public RecordingPoolProperties getRecording() {
        return recording;
    }

    public void setRecording(RecordingPoolProperties recording) {
        this.recording = recording;
    }

    public MeteringPoolProperties getMetering() {
        return metering;
    }

    public void setMetering(MeteringPoolProperties metering) {
        this.metering = metering;
    }

    /**
     * Recording writer pool configuration.
     */
    public static class RecordingPoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "recording-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Metering scheduler configuration.
     */
    public static class MeteringPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "metering-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
