package com.syncrecovery.engine.replay;

import com.syncrecovery.core.model.ChangeEvent;

import java.util.function.Predicate;

/**
 * Named predicate picking the events a SELECTIVE replay re-executes.
 */
public interface ReplaySelector {

    String name();

    boolean test(ChangeEvent event);

    static ReplaySelector of(String name, Predicate<ChangeEvent> predicate) {
        return new ReplaySelector() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean test(ChangeEvent event) {
                return predicate.test(event);
            }
        };
    }
}
