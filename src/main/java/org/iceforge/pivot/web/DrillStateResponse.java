package org.iceforge.pivot.web;

import org.iceforge.pivot.drill.DrillKey;
import org.iceforge.pivot.drill.DrillState;

import java.util.List;

public record DrillStateResponse(String drillStateId, List<DrillKey> expanded) {

    static DrillStateResponse of(String id, DrillState state) {
        return new DrillStateResponse(id, List.copyOf(state.expandedKeys()));
    }
}
