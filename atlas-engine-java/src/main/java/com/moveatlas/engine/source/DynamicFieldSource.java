package com.moveatlas.engine.source;

import java.util.List;

/**
 * Dynamic-field children and single-object detail lookups.
 */
public interface DynamicFieldSource {

    /** Direct dynamic-field children of an object. */
    List<String> listDynamicFields(String parentObjectId);

    ObjectDetail getObject(String objectId);

    /**
     * @param type struct type of the object, may be null
     */
    record ObjectDetail(OwnerInfo owner, String type) {}
}
