package com.chromatrace.core.tree;

import com.chromatrace.ChromatraceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds renderable search trees, applying the configured size cap.
 */
@Service
public class SearchTreeService {

    private static final Logger log = LoggerFactory.getLogger(SearchTreeService.class);

    private final ChromatraceProperties properties;

    public SearchTreeService(ChromatraceProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the tree and its layout, or empty when {@code k^n} exceeds {@code chromatrace.tree.max-leaves}
     */
    public Optional<SearchTree> build(int n, int k) {
        long maxLeaves = properties.getTree().getMaxLeaves();
        var levels = TreeIndexer.buildTree(n, k, maxLeaves);
        if (levels.isEmpty()) {
            log.warn("Tree too large to render (k={}, depth={}, cap={} leaves), skipping", k, n, maxLeaves);
            return Optional.empty();
        }
        var tree = properties.getTree();
        var geometry = new TreeLayout.Geometry(tree.getBaseGap(), tree.getLevelGap(), tree.getTopMargin());
        return Optional.of(new SearchTree(n, k, levels.get(), TreeLayout.layout(levels.get(), k, geometry)));
    }
}
