package com.valkyrlabs.gruff.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the authorization and versioning core, bound from {@code gruff.*}.
 */
@ConfigurationProperties(prefix = "gruff")
public class GruffProperties {

    private final Acl acl = new Acl();
    private final Groups groups = new Groups();
    private final Cache cache = new Cache();

    public Acl getAcl() {
        return acl;
    }

    public Groups getGroups() {
        return groups;
    }

    public Cache getCache() {
        return cache;
    }

    public static class Acl {

        /**
         * Largest accessible-ACL set rendered as an IN list. Above it, list queries
         * fall back to filtering rows after the fetch.
         */
        private int inClauseThreshold = 1000;

        /** Multiplier on the requested page size when filtering after the fetch. */
        private int overFetchFactor = 3;

        public int getInClauseThreshold() {
            return inClauseThreshold;
        }

        public void setInClauseThreshold(int inClauseThreshold) {
            this.inClauseThreshold = inClauseThreshold;
        }

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }
    }

    public static class Groups {

        private int maxNestingDepth = 10;

        public int getMaxNestingDepth() {
            return maxNestingDepth;
        }

        public void setMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
        }
    }

    public static class Cache {

        private Duration effectiveGroupsTtl = Duration.ofMinutes(5);

        /** Lifetime of the membership version counter itself. */
        private Duration versionCounterTtl = Duration.ofHours(24);

        /** Stamped into every cache record; records with another stamp read as misses. */
        private int formatVersion = 1;

        private long maximumSize = 10_000;

        public Duration getEffectiveGroupsTtl() {
            return effectiveGroupsTtl;
        }

        public void setEffectiveGroupsTtl(Duration effectiveGroupsTtl) {
            this.effectiveGroupsTtl = effectiveGroupsTtl;
        }

        public Duration getVersionCounterTtl() {
            return versionCounterTtl;
        }

        public void setVersionCounterTtl(Duration versionCounterTtl) {
            this.versionCounterTtl = versionCounterTtl;
        }

        public int getFormatVersion() {
            return formatVersion;
        }

        public void setFormatVersion(int formatVersion) {
            this.formatVersion = formatVersion;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }
}
