package com.familygraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits for relatives discovery and lineage path queries.
 * Define them in application.yml under 'familygraph'.
 */
@Configuration
@ConfigurationProperties(prefix = "familygraph")
public class GraphProperties {

    private EdgeScope edgeScope = EdgeScope.NEIGHBOURHOOD;
    private Relatives relatives = new Relatives();
    private LineagePath lineagePath = new LineagePath();

    public EdgeScope getEdgeScope() { return edgeScope; }
    public void setEdgeScope(EdgeScope edgeScope) { this.edgeScope = edgeScope; }

    public Relatives getRelatives() { return relatives; }
    public void setRelatives(Relatives relatives) { this.relatives = relatives; }

    public LineagePath getLineagePath() { return lineagePath; }
    public void setLineagePath(LineagePath lineagePath) { this.lineagePath = lineagePath; }

    /**
     * How much of the relationship table a query pulls into memory.
     */
    public enum EdgeScope {
        /** Only edges within the query's hop limit of its starting person. */
        NEIGHBOURHOOD,
        /** Every active edge. */
        ALL
    }

    public static class Relatives {
        private int maxDepth = 20;
        private int maxResults = 100;
        private int defaultDepth = 3;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }

        public int getDefaultDepth() { return defaultDepth; }
        public void setDefaultDepth(int defaultDepth) { this.defaultDepth = defaultDepth; }
    }

    public static class LineagePath {
        private int maxDepth = 20;

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    }
}
