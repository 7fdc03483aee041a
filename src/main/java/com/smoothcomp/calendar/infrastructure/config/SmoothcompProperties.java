package com.smoothcomp.calendar.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Source, refresh, feed and static export settings. Invalid values fail startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "smoothcomp")
public class SmoothcompProperties {

    @Valid
    private Source source = new Source();
    @Valid
    private Refresh refresh = new Refresh();
    @Valid
    private Calendar calendar = new Calendar();
    @Valid
    private StaticSite staticSite = new StaticSite();

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public void setRefresh(Refresh refresh) {
        this.refresh = refresh;
    }

    public Calendar getCalendar() {
        return calendar;
    }

    public void setCalendar(Calendar calendar) {
        this.calendar = calendar;
    }

    public StaticSite getStaticSite() {
        return staticSite;
    }

    public void setStaticSite(StaticSite staticSite) {
        this.staticSite = staticSite;
    }

    public static class Source {

        @NotBlank
        private String baseUrl = "https://smoothcomp.com/";
        @NotBlank
        private String listingPath = "en/events/upcoming";
        @NotBlank
        private String userAgent = "SmoothcompCalendar/1.0";
        @NotNull
        private Duration pageTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getListingPath() {
            return listingPath;
        }

        public void setListingPath(String listingPath) {
            this.listingPath = listingPath;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public Duration getPageTimeout() {
            return pageTimeout;
        }

        public void setPageTimeout(Duration pageTimeout) {
            this.pageTimeout = pageTimeout;
        }
    }

    public static class Refresh {

        @Positive
        private int ttlHours = 1;
        private Duration rateLimit = Duration.ofMillis(300);
        @Positive
        private Integer maxEvents;
        private boolean schedulerEnabled = true;
        @Positive
        private long checkInterval = 60_000;
        private boolean refreshOnStartup = true;

        public int getTtlHours() {
            return ttlHours;
        }

        public void setTtlHours(int ttlHours) {
            this.ttlHours = ttlHours;
        }

        public Duration getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(Duration rateLimit) {
            this.rateLimit = rateLimit;
        }

        public Integer getMaxEvents() {
            return maxEvents;
        }

        public void setMaxEvents(Integer maxEvents) {
            this.maxEvents = maxEvents;
        }

        public boolean isSchedulerEnabled() {
            return schedulerEnabled;
        }

        public void setSchedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
        }

        public long getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(long checkInterval) {
            this.checkInterval = checkInterval;
        }

        public boolean isRefreshOnStartup() {
            return refreshOnStartup;
        }

        public void setRefreshOnStartup(boolean refreshOnStartup) {
            this.refreshOnStartup = refreshOnStartup;
        }
    }

    public static class Calendar {

        @Positive
        private int ttlMinutes = 360;
        @NotBlank
        private String namePrefix = "Smoothcomp";

        public int getTtlMinutes() {
            return ttlMinutes;
        }

        public void setTtlMinutes(int ttlMinutes) {
            this.ttlMinutes = ttlMinutes;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class StaticSite {

        private boolean enabled = false;
        @NotBlank
        private String outputDir = "static";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }
    }
}
