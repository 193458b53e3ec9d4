package com.itguru.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Reactor Netty connectors for outbound calls: a response timeout plus the
 * {@code HTTPS_PROXY}/{@code HTTP_PROXY} proxy when one is set.
 */
@Slf4j
public final class HttpConnectors {

    private HttpConnectors() {}

    public static ReactorClientHttpConnector connector(String tag, Duration responseTimeout) {
        HttpClient http = HttpClient.create();
        if (responseTimeout != null && !responseTimeout.isZero()) {
            http = http.responseTimeout(responseTimeout);
        }
        ProxyTarget proxy = proxyFromEnv(System.getenv("HTTPS_PROXY"), System.getenv("HTTP_PROXY"));
        if (proxy != null) {
            http = http.proxy(p -> {
                ProxyProvider.Builder pb = p.type(proxy.type()).host(proxy.host()).port(proxy.port());
                if (StringUtils.hasText(proxy.username())) {
                    pb.username(proxy.username());
                    if (StringUtils.hasText(proxy.password())) {
                        pb.password(u -> proxy.password());
                    }
                }
            });
            log.info("[http:{}] proxy {}:{} ({})", tag, proxy.host(), proxy.port(), proxy.type());
        }
        return new ReactorClientHttpConnector(http);
    }

    static ProxyTarget proxyFromEnv(String httpsProxy, String httpProxy) {
        String raw = StringUtils.hasText(httpsProxy) ? httpsProxy : httpProxy;
        if (!StringUtils.hasText(raw)) return null;
        URI u;
        try {
            u = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("[http] ignoring malformed proxy setting: {}", e.getMessage());
            return null;
        }
        if (!StringUtils.hasText(u.getHost()) || u.getPort() <= 0) return null;

        String scheme = u.getScheme() == null ? "http" : u.getScheme().toLowerCase(Locale.ROOT);
        ProxyProvider.Proxy type = scheme.startsWith("socks5") ? ProxyProvider.Proxy.SOCKS5
                : scheme.startsWith("socks4") ? ProxyProvider.Proxy.SOCKS4
                : ProxyProvider.Proxy.HTTP;

        String user = null;
        String pass = null;
        String info = u.getUserInfo();
        if (StringUtils.hasText(info)) {
            int idx = info.indexOf(':');
            user = idx >= 0 ? info.substring(0, idx) : info;
            pass = idx >= 0 ? info.substring(idx + 1) : null;
        }
        return new ProxyTarget(type, u.getHost(), u.getPort(), user, pass);
    }

    record ProxyTarget(ProxyProvider.Proxy type, String host, int port, String username, String password) {}
}
