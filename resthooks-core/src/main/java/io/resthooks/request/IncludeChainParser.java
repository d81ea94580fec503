package io.resthooks.request;

import io.resthooks.core.RelationshipAttribute;
import io.resthooks.graph.ResourceGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses include expressions like {@code "author.articles,tags"} into relationship chains.
 */
public final class IncludeChainParser {
    private final ResourceGraph resourceGraph;

    public IncludeChainParser(ResourceGraph resourceGraph) {
        this.resourceGraph = resourceGraph;
    }

    /**
     * @param rootType the primary resource type of the request
     * @param include comma separated dot paths, may be null or blank
     * @return one chain per path, in declaration order
     * @throws InvalidIncludeException if a path segment is unknown or not includable
     */
    public List<List<RelationshipAttribute>> parse(Class<?> rootType, String include) {
        var chains = new ArrayList<List<RelationshipAttribute>>();
        if (include == null || include.isBlank()) {
            return chains;
        }
        for (var rawPath : include.split(",")) {
            var path = rawPath.trim();
            if (path.isEmpty()) {
                throw new InvalidIncludeException("Empty include path in '" + include + "'", include);
            }
            chains.add(parseChain(rootType, path));
        }
        return chains;
    }

    public IncludeService parseService(Class<?> rootType, String include) {
        return new DefaultIncludeService(parse(rootType, include));
    }

    private List<RelationshipAttribute> parseChain(Class<?> rootType, String path) {
        var chain = new ArrayList<RelationshipAttribute>();
        Class<?> current = rootType;
        for (var segment : path.split("\\.", -1)) {
            var relationship = resourceGraph.getRelationship(current, segment);
            if (relationship == null) {
                throw new InvalidIncludeException("Relationship '" + segment + "' in include path '" + path
                        + "' does not exist on " + current.getSimpleName(), path);
            }
            if (!relationship.canInclude()) {
                throw new InvalidIncludeException("Relationship '" + segment + "' in include path '" + path
                        + "' cannot be included", path);
            }
            chain.add(relationship);
            current = relationship.rightType();
        }
        return chain;
    }
}
