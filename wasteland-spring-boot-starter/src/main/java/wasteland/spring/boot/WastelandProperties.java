package wasteland.spring.boot;

import wasteland.Mode;
import wasteland.retry.ExponentialBackoffRetryPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the wanted-board client.
 *
 * @see WastelandAutoConfiguration
 */
@ConfigurationProperties(prefix = "wasteland")
public class WastelandProperties {

    /**
     * Handle of the rig acting through this application. Required.
     */
    private String rigHandle = "";

    /**
     * Workflow mode: wild-west (commit to main) or pr (commit to mutation branches).
     */
    private Mode mode = Mode.WILD_WEST;

    /**
     * Whether commits are GPG-signed.
     */
    private boolean signing = false;

    /**
     * HOP URI of the rig, recorded on completions and stamps.
     */
    private String hopUri = "";

    private final Upstream upstream = new Upstream();
    private final Store store = new Store();
    private final PrRetry prRetry = new PrRetry();
    private final Metrics metrics = new Metrics();

    public String getRigHandle() {
        return rigHandle;
    }

    public void setRigHandle(String rigHandle) {
        this.rigHandle = rigHandle;
    }

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public boolean isSigning() {
        return signing;
    }

    public void setSigning(boolean signing) {
        this.signing = signing;
    }

    public String getHopUri() {
        return hopUri;
    }

    public void setHopUri(String hopUri) {
        this.hopUri = hopUri;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public Store getStore() {
        return store;
    }

    public PrRetry getPrRetry() {
        return prRetry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * The upstream commons this application's client is registered under in the workspace.
     */
    public static class Upstream {
        private String name = "";
        private String forkOrg = "";
        private String forkDb = "";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getForkOrg() {
            return forkOrg;
        }

        public void setForkOrg(String forkOrg) {
            this.forkOrg = forkOrg;
        }

        public String getForkDb() {
            return forkDb;
        }

        public void setForkDb(String forkDb) {
            this.forkDb = forkDb;
        }
    }

    public static class Store {
        /**
         * Commons store name ({@code dolt} or {@code h2}); detected from the JDBC URL when empty.
         */
        private String type = "";
        private String originRemote = "origin";
        private String upstreamRemote = "upstream";
        private boolean wildWest = true;
        private boolean resetMainOnSync = false;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getOriginRemote() {
            return originRemote;
        }

        public void setOriginRemote(String originRemote) {
            this.originRemote = originRemote;
        }

        public String getUpstreamRemote() {
            return upstreamRemote;
        }

        public void setUpstreamRemote(String upstreamRemote) {
            this.upstreamRemote = upstreamRemote;
        }

        public boolean isWildWest() {
            return wildWest;
        }

        public void setWildWest(boolean wildWest) {
            this.wildWest = wildWest;
        }

        public boolean isResetMainOnSync() {
            return resetMainOnSync;
        }

        public void setResetMainOnSync(boolean resetMainOnSync) {
            this.resetMainOnSync = resetMainOnSync;
        }
    }

    public static class PrRetry {
        private long baseDelayMs = ExponentialBackoffRetryPolicy.DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = ExponentialBackoffRetryPolicy.DEFAULT_MAX_DELAY_MS;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "wasteland";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
