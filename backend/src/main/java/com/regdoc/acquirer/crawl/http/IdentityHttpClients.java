package com.regdoc.acquirer.crawl.http;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.identity.IdentityProtocol;
import com.regdoc.acquirer.crawl.identity.NetworkIdentity;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

@Component
public class IdentityHttpClients {
    static final String TUNNELING_DISABLED_SCHEMES = "jdk.http.auth.tunneling.disabledSchemes";

    static {
        allowBasicProxyTunneling();
    }

    private final AcquirerProperties properties;
    private final ExecutorService httpExecutor;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public IdentityHttpClients(
        AcquirerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.httpExecutor = httpExecutor;
    }

    /**
     * The JDK refuses Basic credentials on CONNECT unless this is cleared before its HTTP stack
     * first loads. An explicit operator setting is left alone.
     */
    public static void allowBasicProxyTunneling() {
        if (System.getProperty(TUNNELING_DISABLED_SCHEMES) == null) {
            System.setProperty(TUNNELING_DISABLED_SCHEMES, "");
        }
    }

    public HttpClient direct() {
        return clientFor(NetworkIdentity.direct());
    }

    public HttpClient clientFor(NetworkIdentity identity) {
        NetworkIdentity safe = identity == null ? NetworkIdentity.direct() : identity;
        if (!safe.isDirect() && !IdentityProtocol.HTTP_CLIENT_COMPATIBLE.contains(safe.protocol())) {
            throw new IllegalArgumentException("HttpClient cannot route through " + safe.protocol() + " identity " + safe.name());
        }
        return clients.computeIfAbsent(safe.key(), ignored -> build(safe));
    }

    private HttpClient build(NetworkIdentity identity) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getTimeouts().getRequestSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        if (!identity.isDirect()) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(identity.host(), identity.port())));
            if (identity.hasCredentials()) {
                builder.authenticator(new ProxyCredentials(identity.username(), identity.password()));
            }
        }
        return builder.build();
    }

    private static final class ProxyCredentials extends Authenticator {
        private final String username;
        private final char[] password;

        private ProxyCredentials(String username, String password) {
            this.username = username;
            this.password = password == null ? new char[0] : password.toCharArray();
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() != RequestorType.PROXY) {
                return null;
            }
            return new PasswordAuthentication(username, password);
        }
    }
}
