package com.moveatlas.engine.static_analysis;

import com.moveatlas.engine.graph.GraphModel.ModuleConstant;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FieldDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.FunctionDescriptor;
import com.moveatlas.engine.static_analysis.ModuleDescriptor.StructDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Approximates module-level constants from normalized metadata, which does not expose the
 * constant pool directly:
 * - structs whose name is all upper case or contains CONST contribute one constant per field
 * - exposed functions named get_*, constant_* or all upper case with a return value
 *   contribute one constant each
 */
public class ConstantExtractor {

    public List<ModuleConstant> extract(ModuleDescriptor module) {
        List<ModuleConstant> constants = new ArrayList<>();

        for (StructDescriptor struct : module.structs()) {
            String name = struct.name();
            if (!name.toUpperCase(Locale.ROOT).equals(name) && !name.contains("CONST")) continue;
            for (FieldDescriptor field : struct.fields()) {
                constants.add(new ModuleConstant(
                        name + "::" + field.name(),
                        field.type().render(),
                        field.name()));
            }
        }

        for (FunctionDescriptor fn : module.functions()) {
            String name = fn.name();
            boolean constantLike = name.startsWith("get_")
                    || name.startsWith("constant_")
                    || name.toUpperCase(Locale.ROOT).equals(name);
            if (!constantLike || fn.returns().isEmpty()) continue;
            constants.add(new ModuleConstant(
                    name,
                    fn.returns().get(0).render(),
                    "<from function " + name + ">"));
        }
        return constants;
    }
}
