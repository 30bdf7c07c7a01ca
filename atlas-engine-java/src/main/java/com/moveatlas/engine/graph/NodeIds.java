package com.moveatlas.engine.graph;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates deterministic, stable node IDs following the convention:
 *   pkg:&lt;address&gt;
 *   mod:&lt;address&gt;::&lt;module&gt;
 *   type:&lt;address&gt;::&lt;module&gt;::&lt;struct&gt;
 *   obj:&lt;objectId&gt;
 *   addr:&lt;address&gt;
 *   evt:&lt;txDigest&gt;:&lt;eventSeq&gt;
 */
public final class NodeIds {

    public static final String PACKAGE = "pkg:";
    public static final String MODULE = "mod:";
    public static final String TYPE = "type:";
    public static final String OBJECT = "obj:";
    public static final String ADDRESS = "addr:";
    public static final String EVENT = "evt:";

    private static final Pattern PACKAGE_OF_FQN = Pattern.compile("^(0x[a-fA-F0-9]+)::");
    private static final Pattern MODULE_OF_FQN = Pattern.compile("^0x[a-fA-F0-9]+::([^:]+)::");

    private NodeIds() {}

    public static String forPackage(String address)  { return PACKAGE + address; }
    public static String forModule(String moduleFqn) { return MODULE + moduleFqn; }
    public static String forType(String typeFqn)     { return TYPE + typeFqn; }
    public static String forObject(String objectId)  { return OBJECT + objectId; }
    public static String forAddress(String address)  { return ADDRESS + address; }

    public static String forEvent(String txDigest, String eventSeq) {
        return EVENT + txDigest + ":" + eventSeq;
    }

    /**
     * Strip the prefix from an ID of the given kind; IDs without the prefix are returned as-is.
     */
    public static String strip(String id, String prefix) {
        return id != null && id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }

    /**
     * Package address at the start of a fully-qualified name ({@code 0x2::coin::Coin} → {@code 0x2}),
     * or null if the string does not start with a hex address.
     */
    public static String packageAddressOf(String fqn) {
        if (fqn == null) return null;
        Matcher m = PACKAGE_OF_FQN.matcher(fqn);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Module segment of a type FQN ({@code 0x2::coin::Coin} → {@code coin}), or null.
     * Requires a member segment after the module.
     */
    public static String moduleNameOf(String fqn) {
        if (fqn == null) return null;
        Matcher m = MODULE_OF_FQN.matcher(fqn);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Owning module FQN of a type FQN ({@code 0x2::coin::Coin} → {@code 0x2::coin}), or null.
     */
    public static String moduleFqnOf(String typeFqn) {
        String pkg = packageAddressOf(typeFqn);
        String mod = moduleNameOf(typeFqn);
        return pkg != null && mod != null ? pkg + "::" + mod : null;
    }

    /** Short name: the last {@code ::} segment, ignoring any type arguments. */
    public static String shortName(String fqn) {
        String base = fqn;
        int generic = base.indexOf('<');
        if (generic >= 0) base = base.substring(0, generic);
        int sep = base.lastIndexOf("::");
        return sep >= 0 ? base.substring(sep + 2) : base;
    }
}
