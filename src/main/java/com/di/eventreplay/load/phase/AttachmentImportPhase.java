package com.di.eventreplay.load.phase;

import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.message.EventPath;
import com.di.eventreplay.model.AttachmentData;
import com.di.eventreplay.model.DbBnsSubdomain;
import com.di.eventreplay.model.DbBnsZoneFile;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.tsv.PreorgRecord;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * BNS zonefiles and subdomains from {@code /attachments/new}. A subdomain brings its
 * own zonefile, stored next to the parent one. Both tables are unique on
 * (hash or name, tx, block) and the node may announce the same attachment more than
 * once, so rows already written in this phase are skipped.
 */
@Slf4j
public class AttachmentImportPhase extends ImportPhase {

    public AttachmentImportPhase(EventImportStore store, CoreNodeMessageParser parser,
                                 ImportMetrics metrics, ImportEventLogger events) {
        super(store, parser, metrics, events);
    }

    @Override
    public String name() {
        return "attachments";
    }

    @Override
    public List<String> tables() {
        return List.of("zonefiles", "subdomains");
    }

    @Override
    protected String pathFilter() {
        return EventPath.ATTACHMENTS_NEW;
    }

    @Override
    protected PhaseWriter newWriter(ImportContext ctx) {
        return new Writer();
    }

    private final class Writer implements PhaseWriter {

        private final Set<String> zonefileKeys  = new HashSet<>();
        private final Set<String> subdomainKeys = new HashSet<>();
        private long duplicates;

        @Override
        public void write(PreorgRecord record) {
            AttachmentData data = parser.parseAttachments(record.payload());
            for (DbBnsZoneFile zonefile : data.getZoneFiles()) {
                writeZonefile(zonefile);
            }
            for (DbBnsSubdomain subdomain : data.getSubdomains()) {
                String key = subdomain.getFullyQualifiedSubdomain() + "," + subdomain.getTxId() + "," + subdomain.getIndexBlockHash();
                if (!subdomainKeys.add(key)) {
                    duplicates++;
                    continue;
                }
                insert("subdomains", "insertSubdomain", 1, () -> store.insertSubdomain(subdomain));
                writeZonefile(DbBnsZoneFile.builder()
                        .name(subdomain.getFullyQualifiedSubdomain())
                        .zonefile(subdomain.getZonefile())
                        .zonefileHash(subdomain.getZonefileHash())
                        .txId(subdomain.getTxId())
                        .indexBlockHash(subdomain.getIndexBlockHash())
                        .build());
            }
        }

        private void writeZonefile(DbBnsZoneFile zonefile) {
            String key = zonefile.getZonefileHash() + "," + zonefile.getTxId() + "," + zonefile.getIndexBlockHash();
            if (!zonefileKeys.add(key)) {
                duplicates++;
                return;
            }
            insert("zonefiles", "insertZonefile", 1, () -> store.insertZonefile(zonefile));
        }

        @Override
        public void flush() {
            if (duplicates > 0) {
                log.info("[PHASE] attachments skipped {} duplicate zonefile/subdomain rows", duplicates);
            }
        }
    }
}
