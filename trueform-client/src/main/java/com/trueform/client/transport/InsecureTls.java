package com.trueform.client.transport;

import okhttp3.OkHttpClient;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;

/**
 * TLS settings for appliances that serve a self-signed certificate. Applied
 * only when certificate verification has been switched off in the settings.
 */
final class InsecureTls {

    private InsecureTls() {
    }

    private static final X509TrustManager TRUST_ALL = new X509TrustManager() {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    };

    private static final HostnameVerifier ANY_HOST = (hostname, session) -> true;

    static OkHttpClient.Builder apply(OkHttpClient.Builder builder) throws GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[] {TRUST_ALL}, null);
        return builder
                .sslSocketFactory(context.getSocketFactory(), TRUST_ALL)
                .hostnameVerifier(ANY_HOST);
    }
}
