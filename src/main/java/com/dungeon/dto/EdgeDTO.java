package com.dungeon.dto;

import com.dungeon.model.Condition;
import com.dungeon.model.Edge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EdgeDTO {

    private String targetId;
    private String label;
    private boolean hidden;
    private List<String> conditions;
    private Double bearing;

    public static EdgeDTO fromEdge(Edge edge) {
        return EdgeDTO.builder()
                .targetId(edge.getTargetId())
                .label(edge.getLabel())
                .hidden(edge.isHidden())
                .conditions(edge.getConditions().stream().map(Condition::describe).toList())
                .bearing(edge.getBearing())
                .build();
    }
}
