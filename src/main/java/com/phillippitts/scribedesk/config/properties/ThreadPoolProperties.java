package com.phillippitts.scribedesk.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>One recognition worker runs per session, so the defaults are small; a second thread
 * covers a worker still draining while the next run starts.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private RecognitionPoolProperties recognition = new RecognitionPoolProperties();

    public RecognitionPoolProperties getRecognition() {
        return recognition;
    }

    public void setRecognition(RecognitionPoolProperties recognition) {
        this.recognition = recognition;
    }

    /**
     * Recognition executor pool configuration.
     */
    public static class RecognitionPoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "recognition-";

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
}
