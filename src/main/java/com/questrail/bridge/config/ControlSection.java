package com.questrail.bridge.config;

import com.questrail.bridge.control.ControlTimingPolicy;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code control:} section: where and how to reach the daemon's XML-RPC
 * endpoint, either over TCP or over the daemon's local socket
 * ({@code unix:///tmp/supervisor.sock}).
 *
 * <pre>
 * control:
 *   url: http://127.0.0.1:9001/RPC2
 *   username: admin
 *   password: secret
 *   callTimeoutMillis: 3000
 *   stopAllExclusions: [bridge, sshd]
 * </pre>
 */
public class ControlSection {

    public static final String DEFAULT_URL = "http://127.0.0.1:9001/RPC2";

    private String url = DEFAULT_URL;
    private String username;
    private String password;
    private int callTimeoutMillis = (int) ControlTimingPolicy.DEFAULT_CALL_TIMEOUT.toMillis();
    private List<String> stopAllExclusions = new ArrayList<>();

    public void validate() {
        List<String> errors = new ArrayList<>();
        if (url == null || url.isBlank()) {
            errors.add("control.url is required");
        } else {
            try {
                URI uri = new URI(url.trim());
                boolean http = "http".equalsIgnoreCase(uri.getScheme()) && uri.getHost() != null;
                boolean unix = "unix".equalsIgnoreCase(uri.getScheme())
                        && uri.getPath() != null && !uri.getPath().isEmpty();
                if (!http && !unix) {
                    errors.add("control.url must be an http://host[:port]/path or unix:///socket/path URL, got '"
                            + url + "'");
                }
            } catch (URISyntaxException e) {
                errors.add("control.url is not a valid URL: " + e.getMessage());
            }
        }
        if (callTimeoutMillis <= 0) {
            errors.add("control.callTimeoutMillis must be > 0");
        }
        if (password != null && (username == null || username.isBlank())) {
            errors.add("control.password requires control.username");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public URI toUri() {
        return URI.create(url.trim());
    }

    public ControlTimingPolicy toTimingPolicy() {
        return new ControlTimingPolicy(Duration.ofMillis(callTimeoutMillis));
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getCallTimeoutMillis() {
        return callTimeoutMillis;
    }

    public void setCallTimeoutMillis(int callTimeoutMillis) {
        this.callTimeoutMillis = callTimeoutMillis;
    }

    public List<String> getStopAllExclusions() {
        return Collections.unmodifiableList(stopAllExclusions);
    }

    public void setStopAllExclusions(List<String> stopAllExclusions) {
        this.stopAllExclusions = stopAllExclusions != null ? new ArrayList<>(stopAllExclusions) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "ControlSection{" +
                "url='" + url + '\'' +
                ", username='" + username + '\'' +
                ", password=" + (password == null ? "null" : "****") +
                ", callTimeoutMillis=" + callTimeoutMillis +
                ", stopAllExclusions=" + stopAllExclusions +
                '}';
    }
}
