package com.di.eventreplay.tsv;

import java.nio.file.Path;

/**
 * Artifacts ready for loading.
 *
 * @param entityData canonical index of the source log
 * @param preorgPath canonical-only rewrite of the source log
 * @param scanned    whether the source was scanned in this run (cache miss)
 * @param generated  whether the preorg file was written in this run
 */
public record PreparedImport(TsvEntityData entityData, Path preorgPath, boolean scanned, boolean generated) {
}
