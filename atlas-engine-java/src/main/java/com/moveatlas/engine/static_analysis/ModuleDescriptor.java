package com.moveatlas.engine.static_analysis;

import com.google.gson.JsonArray;

import java.util.List;

/**
 * Typed view of one normalized module, produced by {@link ModuleDescriptorParser}.
 */
public record ModuleDescriptor(
    List<FunctionDescriptor> functions,
    List<StructDescriptor> structs,
    List<FriendRef> friends
) {

    /**
     * @param visibility raw visibility string ("Public", "Friend", "Private"), may be null
     * @param rawReturn  the return list as received, null when the descriptor has none
     */
    public record FunctionDescriptor(
        String name,
        String visibility,
        boolean isEntry,
        List<MoveType> parameters,
        List<MoveType> returns,
        JsonArray rawReturn
    ) {}

    public record StructDescriptor(String name, List<String> abilities, List<FieldDescriptor> fields) {}

    public record FieldDescriptor(String name, MoveType type) {}

    public record FriendRef(String address, String name) {
        public String fqn() { return address + "::" + name; }
    }
}
