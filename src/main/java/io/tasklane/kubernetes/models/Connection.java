package io.tasklane.kubernetes.models;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * Explicit API server connection. When absent the client is configured from the environment
 * (kube config file or in-cluster service account).
 */
@Builder
@Getter
@Jacksonized
public class Connection {
    private final Boolean trustCerts;

    private final Boolean disableHostnameVerification;

    @Builder.Default
    private final String masterUrl = "https://kubernetes.default.svc";

    @Builder.Default
    private final String apiVersion = "v1";

    private final String namespace;

    private final String caCertFile;

    private final String caCertData;

    private final String clientCertFile;

    private final String clientCertData;

    private final String clientKeyFile;

    private final String clientKeyData;

    @Builder.Default
    private final String clientKeyAlgo = "RSA";

    private final String clientKeyPassphrase;

    private final String oauthToken;

    private final String username;

    private final String password;

    @Builder.Default
    private final Integer requestTimeout = 10_000;

    public Config toConfig() {
        ConfigBuilder builder = new ConfigBuilder(Config.empty());

        if (trustCerts != null) {
            builder.withTrustCerts(trustCerts);
        }

        if (disableHostnameVerification != null) {
            builder.withDisableHostnameVerification(disableHostnameVerification);
        }

        if (masterUrl != null) {
            builder.withMasterUrl(masterUrl);
        }

        if (apiVersion != null) {
            builder.withApiVersion(apiVersion);
        }

        if (namespace != null) {
            builder.withNamespace(namespace);
        }

        if (caCertFile != null) {
            builder.withCaCertFile(caCertFile);
        }

        if (caCertData != null) {
            builder.withCaCertData(normalizeBase64(caCertData));
        }

        if (clientCertFile != null) {
            builder.withClientCertFile(clientCertFile);
        }

        if (clientCertData != null) {
            builder.withClientCertData(normalizeBase64(clientCertData));
        }

        if (clientKeyFile != null) {
            builder.withClientKeyFile(clientKeyFile);
        }

        if (clientKeyData != null) {
            builder.withClientKeyData(normalizeBase64(clientKeyData));
        }

        if (clientKeyAlgo != null) {
            builder.withClientKeyAlgo(clientKeyAlgo);
        }

        if (clientKeyPassphrase != null) {
            builder.withClientKeyPassphrase(clientKeyPassphrase);
        }

        if (oauthToken != null) {
            builder.withOauthToken(oauthToken);
        }

        if (username != null) {
            builder.withUsername(username);
        }

        if (password != null) {
            builder.withPassword(password);
        }

        if (requestTimeout != null) {
            builder.withRequestTimeout(requestTimeout);
        }

        return builder.build();
    }

    private static String normalizeBase64(String value) {
        return value.replaceAll("\\s", "");
    }
}
