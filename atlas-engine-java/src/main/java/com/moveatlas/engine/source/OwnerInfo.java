package com.moveatlas.engine.source;

import com.moveatlas.engine.graph.GraphModel.OwnerKind;

/**
 * Decoded object owner.
 *
 * @param address owner address for AddressOwner / ObjectOwner, otherwise null
 */
public record OwnerInfo(OwnerKind kind, String address) {

    public OwnerInfo {
        if (kind == null) {
            throw new IllegalArgumentException("owner kind is required");
        }
        if (kind.carriesAddress() && (address == null || address.isEmpty())) {
            throw new IllegalArgumentException(kind + " owner requires an address");
        }
        if (!kind.carriesAddress()) {
            address = null;
        }
    }

    public static OwnerInfo address(String address) { return new OwnerInfo(OwnerKind.ADDRESS_OWNER, address); }
    public static OwnerInfo object(String parentId)  { return new OwnerInfo(OwnerKind.OBJECT_OWNER, parentId); }
    public static OwnerInfo shared()                 { return new OwnerInfo(OwnerKind.SHARED, null); }
    public static OwnerInfo immutable()              { return new OwnerInfo(OwnerKind.IMMUTABLE, null); }
}
