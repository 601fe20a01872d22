package dev.atlassiansdk.jira;

import dev.atlassiansdk.jira.auth.Authentication;
import dev.atlassiansdk.jira.dashboard.DashboardService;
import dev.atlassiansdk.jira.filter.FilterShareService;
import dev.atlassiansdk.jira.internal.Transport;
import dev.atlassiansdk.jira.issue.IssueMetadataService;
import dev.atlassiansdk.jira.issue.WatcherService;
import dev.atlassiansdk.jira.project.ProjectVersionService;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for the Jira Cloud REST API. A client bundles the immutable {@link Config}, the shared
 * {@link Authentication} state and one instance of each resource service. It holds no per-call state and is safe to
 * share between threads: create one per Jira site and reuse it.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JiraClient jira = new JiraClient(Config.builder()
 *     .baseUrl("https://example.atlassian.net")
 *     .basicAuth("me@example.com", apiToken)
 *     .build());
 *
 * ApiResult<DashboardPage> page = jira.dashboards().gets(0, 50, "");
 * }</pre>
 *
 * <p>
 * Every service method validates its identifiers first and throws {@link JiraValidationException} without any I/O
 * when they are missing. Non-2xx answers surface as {@link JiraApiException} carrying the {@link JiraResponse}.
 * </p>
 */
public final class JiraClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(JiraClient.class.getName());

    private final Config config;
    private final Authentication authentication;
    private final FilterShareService filterShare;
    private final ProjectVersionService projectVersions;
    private final IssueMetadataService issueMetadata;
    private final WatcherService watchers;
    private final DashboardService dashboards;

    /**
     * Constructs a client.
     *
     * @param config caller-supplied configuration; only the base URL is mandatory. Defaults are applied again here, so
     *               a configuration assembled by hand is validated the same way as one from {@link Config.Builder#build()}.
     */
    public JiraClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.authentication = new Authentication(this.config.getCredentials(), this.config.getUserAgent());

        Transport transport = new Transport(this.config, authentication);
        this.filterShare = new FilterShareService(transport);
        this.projectVersions = new ProjectVersionService(transport);
        this.issueMetadata = new IssueMetadataService(transport);
        this.watchers = new WatcherService(transport);
        this.dashboards = new DashboardService(transport);

        LOGGER.fine(() -> String.format(Locale.ROOT, "[jira-sdk] client ready for %s (%s)",
            this.config.getBaseUrl(), this.config.getApiVersion().root()));
    }

    public Config config() {
        return config;
    }

    /**
     * @return the credentials and user agent shared by all services; changes apply to the next request.
     */
    public Authentication authentication() {
        return authentication;
    }

    public FilterShareService filterShare() {
        return filterShare;
    }

    public ProjectVersionService projectVersions() {
        return projectVersions;
    }

    public IssueMetadataService issueMetadata() {
        return issueMetadata;
    }

    public WatcherService watchers() {
        return watchers;
    }

    public DashboardService dashboards() {
        return dashboards;
    }

    /**
     * No-op: the {@link java.net.http.HttpClient} is either caller-owned or released with the client by the JVM.
     */
    @Override
    public void close() {
        // nothing to release
    }
}
