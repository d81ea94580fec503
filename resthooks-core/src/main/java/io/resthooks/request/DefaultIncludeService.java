package io.resthooks.request;

import io.resthooks.core.RelationshipAttribute;

import java.util.ArrayList;
import java.util.List;

public final class DefaultIncludeService implements IncludeService {
    private final List<List<RelationshipAttribute>> chains;

    public DefaultIncludeService(List<List<RelationshipAttribute>> chains) {
        var copy = new ArrayList<List<RelationshipAttribute>>(chains.size());
        for (var chain : chains) {
            copy.add(List.copyOf(chain));
        }
        this.chains = List.copyOf(copy);
    }

    @Override
    public List<List<RelationshipAttribute>> get() {
        return chains;
    }
}
