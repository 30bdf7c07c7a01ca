package com.moveatlas.rpc;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.moveatlas.engine.source.ChainObject;
import com.moveatlas.engine.source.ObjectPageSource;
import com.moveatlas.engine.source.OwnerInfo;
import com.moveatlas.engine.source.SourceException;
import com.moveatlas.rpc.transport.GraphQlTransport;
import com.moveatlas.rpc.transport.RpcTransport.RpcException;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed object listing through the Sui GraphQL {@code objects} query.
 *
 * Without a transport (networks that publish no GraphQL endpoint) every page is empty.
 */
public class SuiGraphQlObjectSource implements ObjectPageSource {

    public static final int ESTIMATE_PAGE_SIZE = 50;

    private static final String OBJECTS_QUERY = """
            query {
              objects(filter: { type: %s }, first: %d%s) {
                nodes {
                  address
                  version
                  digest
                  owner {
                    __typename
                    ... on AddressOwner { owner { address } }
                    ... on Parent { parent { address } }
                    ... on Shared { initialSharedVersion }
                  }
                  asMoveObject { contents { json } }
                }
                pageInfo { hasNextPage endCursor }
              }
            }
            """;

    private final GraphQlTransport transport;
    private final String networkName;

    /**
     * @param transport null when the network has no GraphQL endpoint
     */
    public SuiGraphQlObjectSource(GraphQlTransport transport, String networkName) {
        this.transport = transport;
        this.networkName = networkName;
    }

    /** First page of {@value #ESTIMATE_PAGE_SIZE}; failures degrade to an empty estimate. */
    @Override
    public CountEstimate estimateCount(String typeFqn) {
        try {
            ObjectPage first = queryPage(typeFqn, ESTIMATE_PAGE_SIZE, null);
            return new CountEstimate(first.objects().size(), first.hasNextPage());
        } catch (SourceException e) {
            System.err.println("[atlas-rpc] WARNING: count estimate failed for " + typeFqn + ": " + e.getMessage());
            return new CountEstimate(0, false);
        }
    }

    @Override
    public ObjectPage queryPage(String typeFqn, int limit, String cursor) {
        if (transport == null) {
            System.err.println("[atlas-rpc] WARNING: GraphQL not available on " + networkName
                    + ", no objects for " + typeFqn);
            return ObjectPage.empty();
        }

        String after = cursor != null ? ", after: " + quote(cursor) : "";
        JsonObject data;
        try {
            data = transport.query(String.format(OBJECTS_QUERY, quote(typeFqn), limit, after));
        } catch (RpcException e) {
            throw new SourceException("queryObjects", e.getMessage(), e);
        }
        if (!data.has("objects") || !data.get("objects").isJsonObject()) {
            throw new SourceException("queryObjects", "Invalid GraphQL response: missing data.objects");
        }
        JsonObject objects = data.getAsJsonObject("objects");

        List<ChainObject> result = new ArrayList<>();
        JsonElement nodes = objects.get("nodes");
        if (nodes != null && nodes.isJsonArray()) {
            for (JsonElement node : nodes.getAsJsonArray()) {
                if (!node.isJsonObject()) continue;
                try {
                    result.add(toChainObject(node.getAsJsonObject()));
                } catch (SourceException e) {
                    System.err.println("[atlas-rpc] WARNING: skipping object of " + typeFqn + ": " + e.getMessage());
                }
            }
        }

        boolean hasNext = false;
        String endCursor = null;
        if (objects.has("pageInfo") && objects.get("pageInfo").isJsonObject()) {
            JsonObject pageInfo = objects.getAsJsonObject("pageInfo");
            hasNext = pageInfo.has("hasNextPage") && pageInfo.get("hasNextPage").getAsBoolean();
            endCursor = string(pageInfo, "endCursor");
        }
        return new ObjectPage(result, endCursor, hasNext);
    }

    static ChainObject toChainObject(JsonObject node) {
        String address = string(node, "address");
        if (address == null) {
            throw new SourceException("decodeObject", "object without address");
        }
        JsonObject content = null;
        JsonObject moveObject = object(node, "asMoveObject");
        JsonObject contents = moveObject != null ? object(moveObject, "contents") : null;
        if (contents != null) {
            content = object(contents, "json");
        }
        return new ChainObject(address, string(node, "version"), string(node, "digest"),
                decodeOwner(object(node, "owner")), content);
    }

    /**
     * Owner by {@code __typename}: AddressOwner, Shared, Immutable, Parent (object-owned).
     *
     * @throws SourceException for any other shape
     */
    static OwnerInfo decodeOwner(JsonObject owner) {
        String typename = owner != null ? string(owner, "__typename") : null;
        if (typename == null) {
            throw new SourceException("decodeOwner", "owner without __typename");
        }
        switch (typename) {
            case "AddressOwner": {
                JsonObject inner = object(owner, "owner");
                String address = inner != null ? string(inner, "address") : null;
                if (address == null) throw new SourceException("decodeOwner", "AddressOwner without address");
                return OwnerInfo.address(address);
            }
            case "Parent": {
                JsonObject parent = object(owner, "parent");
                String address = parent != null ? string(parent, "address") : null;
                if (address == null) throw new SourceException("decodeOwner", "Parent without address");
                return OwnerInfo.object(address);
            }
            case "Shared":
                return OwnerInfo.shared();
            case "Immutable":
                return OwnerInfo.immutable();
            default:
                throw new SourceException("decodeOwner", "unsupported owner " + typename);
        }
    }

    private static String quote(String s) {
        return new JsonPrimitive(s).toString();
    }

    private static JsonObject object(JsonObject obj, String key) {
        JsonElement v = obj.get(key);
        return v != null && v.isJsonObject() ? v.getAsJsonObject() : null;
    }

    private static String string(JsonObject obj, String key) {
        JsonElement v = obj.get(key);
        return v instanceof JsonPrimitive ? v.getAsString() : null;
    }
}
