package com.gatekeeper.auth.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Test entity stored in {@code inventory.widget}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Widget implements Entity {

    static final EntityDescriptor DESCRIPTOR = EntityDescriptor.of(Widget.class, "inventory");

    private Integer id;
    private String name;
    private Integer quantity;
    private Integer unitPrice;
    private List<String> tags;

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }
}
