package com.trueform.client.errors;

import com.trueform.common.infra.ErrorUtils;
import lombok.Getter;

/**
 * The endpoint could not be dialed. The message is an operator-facing
 * diagnostic with remediation steps.
 */
@Getter
public class ConnectionException extends TrueNasException {

    private final String host;

    public ConnectionException(String host, Throwable cause) {
        super(render(host, cause), cause);
        this.host = host;
    }

    private static String render(String host, Throwable cause) {
        return String.format("""
                failed to connect to TrueNAS at "%s": %s

                Please verify:
                  1. The host is reachable (try: curl -k https://%s/api/current)
                  2. TrueNAS Scale 25.04+ is running and the API is enabled
                  3. Your provider configuration is correct

                Example configuration:

                  provider "trueform" {
                    host       = "192.168.1.100"    # TrueNAS IP or hostname
                    api_key    = "1-xxxx..."        # API key from TrueNAS UI
                    verify_ssl = false              # Set true if using valid SSL cert
                  }

                Or use environment variables:
                  export TRUENAS_HOST="192.168.1.100"
                  export TRUENAS_API_KEY="1-xxxx..."
                  export TRUENAS_VERIFY_SSL="false"
                """, host, ErrorUtils.formatErrorChain(cause), host);
    }
}
