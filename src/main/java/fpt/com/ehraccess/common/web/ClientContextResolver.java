package fpt.com.ehraccess.common.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller context recorded on access log entries (origin IP).
 */
public class ClientContextResolver {
    private final boolean trustProxy;
    private final String header;

    public ClientContextResolver(boolean trustProxy, String header) {
        this.trustProxy = trustProxy;
        this.header = header;
    }

    public String resolve(HttpServletRequest req) {
        if (!trustProxy) return req.getRemoteAddr();
        String h = req.getHeader(header);
        if (h != null && !h.isBlank()) return h.split(",")[0].trim();
        return req.getRemoteAddr();
    }
}
