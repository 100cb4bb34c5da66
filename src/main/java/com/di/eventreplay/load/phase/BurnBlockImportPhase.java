package com.di.eventreplay.load.phase;

import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.message.EventPath;
import com.di.eventreplay.model.BurnBlockData;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;

import java.util.List;

/** Burnchain rewards and reward slot holders of every canonical burn block. */
public class BurnBlockImportPhase extends ImportPhase {

    public BurnBlockImportPhase(EventImportStore store, CoreNodeMessageParser parser,
                                ImportMetrics metrics, ImportEventLogger events) {
        super(store, parser, metrics, events);
    }

    @Override
    public String name() {
        return "burn-blocks";
    }

    @Override
    public List<String> tables() {
        return List.of("burnchain_rewards", "reward_slot_holders");
    }

    @Override
    protected String pathFilter() {
        return EventPath.NEW_BURN_BLOCK;
    }

    @Override
    protected PhaseWriter newWriter(ImportContext ctx) {
        return record -> {
            BurnBlockData data = parser.parseBurnBlock(record.payload());
            insert("burnchain_rewards", "insertBurnchainRewards", data.getRewards().size(),
                    () -> store.insertBurnchainRewards(data.getRewards()));
            insert("reward_slot_holders", "insertRewardSlotHolders", data.getSlotHolders().size(),
                    () -> store.insertRewardSlotHolders(data.getSlotHolders()));
        };
    }
}
