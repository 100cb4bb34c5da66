package com.di.eventreplay.message;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts subdomain records from a name's zonefile.
 *
 * <p>Each subdomain is a TXT record of the form
 * {@code sub TXT "owner=<addr>" "seqn=<n>" "parts=<k>" "zf0=<base64>" ... "zf<k-1>=<base64>"};
 * the {@code zf*} parts concatenate to the subdomain's own (base64) zonefile.
 * TXT records without an {@code owner} are not subdomains and are ignored.
 */
public final class SubdomainZonefileParser {

    private static final Pattern TXT_RECORD = Pattern.compile(
            "^(\\S+)\\s+(?:\\d+\\s+)?(?:IN\\s+)?TXT\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");

    private SubdomainZonefileParser() {
    }

    public record SubdomainEntry(String subdomain, String owner, long sequence, String zonefile) {
    }

    public static List<SubdomainEntry> parse(String zonefile) {
        List<SubdomainEntry> entries = new ArrayList<>();
        if (zonefile == null || zonefile.isEmpty()) {
            return entries;
        }
        for (String rawLine : zonefile.split("\\r?\\n")) {
            Matcher m = TXT_RECORD.matcher(rawLine.trim());
            if (!m.matches() || m.group(1).startsWith("$")) {
                continue;
            }
            Map<String, String> fields = new LinkedHashMap<>();
            Matcher q = QUOTED.matcher(m.group(2));
            while (q.find()) {
                String kv = q.group(1);
                int eq = kv.indexOf('=');
                if (eq > 0) {
                    fields.put(kv.substring(0, eq), kv.substring(eq + 1));
                }
            }
            String owner = fields.get("owner");
            if (owner == null) {
                continue;
            }
            int parts = Integer.parseInt(fields.getOrDefault("parts", "0"));
            StringBuilder encoded = new StringBuilder();
            for (int i = 0; i < parts; i++) {
                String part = fields.get("zf" + i);
                if (part == null) {
                    throw new IllegalArgumentException("Subdomain " + m.group(1) + " is missing zonefile part zf" + i);
                }
                encoded.append(part);
            }
            String subZonefile = new String(Base64.getDecoder().decode(encoded.toString()), StandardCharsets.UTF_8);
            entries.add(new SubdomainEntry(m.group(1), owner,
                    Long.parseLong(fields.getOrDefault("seqn", "0")), subZonefile));
        }
        return entries;
    }
}
