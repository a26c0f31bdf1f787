package com.example.invoiceflow.infrastructure.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Blob store settings bound from {@code invoice.storage.*}.
 */
@ConfigurationProperties(prefix = "invoice.storage")
public class StorageProperties {

    private final Gcs gcs = new Gcs();
    private final Local local = new Local();

    public Gcs getGcs() {
        return gcs;
    }

    public Local getLocal() {
        return local;
    }

    public static class Gcs {

        /**
         * Flag indicating whether {@code gs://} references are served from Google Cloud Storage.
         */
        private boolean enabled;

        /**
         * Optional path or resource string that resolves to the service account credentials file.
         * When omitted, application default credentials will be used.
         */
        private String credentials;

        /**
         * Optional Google Cloud project identifier used when building the storage client.
         */
        private String projectId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCredentials() {
            return credentials;
        }

        public void setCredentials(String credentials) {
            this.credentials = credentials;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }
    }

    public static class Local {

        /**
         * Root directory of the filesystem store; each container is a sub directory.
         */
        private String root = "./data/blobs";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }
    }
}
