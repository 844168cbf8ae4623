package com.roster.matching.directory;

import com.roster.matching.core.model.PlayerRecord;

import java.util.List;

/**
 * Read-only lookup into a league's player directory snapshot.
 *
 * <p>Implementations filter by every constraint present in the query except the
 * first name, which is advisory: they may use it to prefilter, but must not drop
 * nickname or misspelled variants, since first-name equivalence is decided by the
 * caller. Failures (I/O, database) are thrown as-is; the matcher does not retry them.</p>
 */
public interface PlayerDirectory {

    List<PlayerRecord> query(DirectoryQuery query);
}
