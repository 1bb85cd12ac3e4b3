package io.github.nabilcarel.gateway.model.composite;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class CompositeDefinition {
    private String name;
    private String description;

    @Builder.Default
    private List<CompositeStep> steps = new ArrayList<>();
}
