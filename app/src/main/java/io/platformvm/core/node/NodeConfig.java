package io.platformvm.core.node;

/** Simple config holder for a local node. */
public final class NodeConfig {
    public final String namespace;
    public final String metricsBind;
    public final int metricsPort;
    public final String metricsToken;

    public NodeConfig(String namespace, String metricsBind, int metricsPort, String metricsToken) {
        this.namespace = namespace == null ? "" : namespace;
        this.metricsBind = (metricsBind == null || metricsBind.isBlank()) ? "127.0.0.1" : metricsBind;
        this.metricsPort = metricsPort;
        this.metricsToken = (metricsToken == null || metricsToken.isBlank()) ? null : metricsToken;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                "platformvm",   // metric name prefix
                "127.0.0.1",
                9650,
                null            // metrics endpoint open
        );
    }

    public NodeConfig withNamespace(String namespace) {
        return new NodeConfig(namespace, this.metricsBind, this.metricsPort, this.metricsToken);
    }

    public NodeConfig withMetricsEndpoint(String bind, int port, String token) {
        return new NodeConfig(this.namespace, bind, port, token);
    }
}
