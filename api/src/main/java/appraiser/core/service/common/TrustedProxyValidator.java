package appraiser.core.service.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import appraiser.core.config.TrustedProxyConfig;

/**
 * Decides whether a peer is a trusted proxy, so its forwarding headers may name the client.
 *
 * <p>Rules are parsed once at startup. Invalid entries are logged and skipped.
 * Hostnames are never resolved.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final List<ProxyRule> rules;

    /** Network address plus the number of leading bits that must match. */
    record ProxyRule(byte[] network, int prefixLength) {

        boolean matches(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            for (var i = 0; i < fullBytes; i++) {
                if (network[i] != address[i]) {
                    return false;
                }
            }
            final var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            final var mask = 0xFF << (8 - remainingBits);
            return (network[fullBytes] & mask) == (address[fullBytes] & mask);
        }
    }

    @Inject
    public TrustedProxyValidator(TrustedProxyConfig config) {
        this(config.proxies().orElse(List.of()));
    }

    public TrustedProxyValidator(List<String> proxies) {
        final var parsed = new ArrayList<ProxyRule>();
        for (final var entry : proxies) {
            final var rule = parseRule(entry.trim());
            if (rule == null) {
                LOG.warnf("Ignoring invalid trusted proxy entry: %s", entry);
            } else {
                parsed.add(rule);
            }
        }
        this.rules = List.copyOf(parsed);
        if (!rules.isEmpty()) {
            LOG.infof("Trusting forwarding headers from %d proxy rule(s)", rules.size());
        }
    }

    /**
     * Check whether forwarding headers from the given peer should be believed.
     *
     * @param peerIp the direct connection's remote IP address
     * @return true only when the peer matches a configured proxy
     */
    public boolean isTrustedProxy(String peerIp) {
        if (rules.isEmpty()) {
            return false;
        }
        final var address = parseLiteral(peerIp);
        if (address == null) {
            return false;
        }
        return rules.stream().anyMatch(rule -> rule.matches(address));
    }

    private static ProxyRule parseRule(String entry) {
        final var slash = entry.indexOf('/');
        if (slash < 0) {
            final var address = parseLiteral(entry);
            return address == null ? null : new ProxyRule(address, address.length * 8);
        }
        final var network = parseLiteral(entry.substring(0, slash));
        if (network == null) {
            return null;
        }
        try {
            final var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > network.length * 8) {
                return null;
            }
            return new ProxyRule(network, prefixLength);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Returns the address bytes of an IP literal, or null for anything else. */
    static byte[] parseLiteral(String input) {
        if (!isIpLiteral(input)) {
            return null;
        }
        try {
            // only reached for literals, so no lookup happens
            return InetAddress.getByName(input).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean isIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.contains(":")) {
            return input.chars().allMatch(c -> c == ':' || c == '.' || Character.digit(c, 16) >= 0);
        }
        if (!Character.isDigit(input.charAt(0))) {
            return false;
        }
        return input.chars().allMatch(c -> c == '.' || Character.isDigit(c));
    }
}
