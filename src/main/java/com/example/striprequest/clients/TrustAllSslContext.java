package com.example.striprequest.clients;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

/**
 * Process-wide TLS context that accepts any server certificate. Probed endpoints are routinely
 * self-signed or addressed by IP, so certificate validation is not part of a probe.
 * <p>
 * Built once on first use and never mutated afterwards.
 */
final class TrustAllSslContext {

    private TrustAllSslContext() {
    }

    static SSLSocketFactory socketFactory() {
        return Holder.FACTORY;
    }

    private static final class Holder {
        private static final SSLSocketFactory FACTORY = create().getSocketFactory();

        private static SSLContext create() {
            try {
                SSLContext context = SSLContext.getInstance("TLS");
                context.init(null, new TrustManager[] {new TrustAnythingManager()}, null);
                return context;
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Unable to initialise TLS context: " + e.getMessage(), e);
            }
        }
    }

    private static final class TrustAnythingManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // all clients accepted
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // all servers accepted
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
