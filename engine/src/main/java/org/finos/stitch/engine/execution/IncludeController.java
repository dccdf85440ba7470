package org.finos.stitch.engine.execution;

import org.finos.stitch.dsl.IncludeCompileException;
import org.finos.stitch.dsl.IncludeCompiler;
import org.finos.stitch.engine.config.StitchSettings;
import org.finos.stitch.engine.plan.IncludePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs compile and stitch for one request and applies the failure policy.
 * 
 * <ul>
 * <li>compile errors always reject the request</li>
 * <li>strict mode: a stitch failure aborts the request, no rows are returned</li>
 * <li>non-strict mode (default): the root rows are returned unchanged with an
 * include error describing what is missing</li>
 * </ul>
 */
public class IncludeController {

    private final IncludeCompiler compiler;
    private final BatchStitcher stitcher;
    private final StitchSettings settings;
    private final Logger log;

    public IncludeController(IncludeCompiler compiler, BatchStitcher stitcher, StitchSettings settings) {
        this(compiler, stitcher, settings, LoggerFactory.getLogger(IncludeController.class));
    }

    public IncludeController(IncludeCompiler compiler, BatchStitcher stitcher, StitchSettings settings,
            Logger log) {
        this.compiler = compiler;
        this.stitcher = stitcher;
        this.settings = settings;
        this.log = log;
    }

    /**
     * Resolves the include request for already-fetched root rows.
     * 
     * @param entity   Entity of the root rows
     * @param rootRows Root rows; never modified
     * @param rawSpec  The raw {@code include} value of the request, may be null
     * @return The terminal outcome
     */
    public IncludeOutcome resolve(String entity, List<Map<String, Object>> rootRows, Object rawSpec) {
        IncludePlan plan;
        try {
            plan = compiler.compile(entity, rawSpec, settings.maxIncludeDepth());
        } catch (IncludeCompileException e) {
            log.debug("Rejected include on {}: {}", entity, e.getMessage());
            return new IncludeOutcome.Rejected(e);
        }

        if (plan.isEmpty() || rootRows.isEmpty()) {
            return new IncludeOutcome.Stitched(rootRows);
        }

        try {
            return new IncludeOutcome.Stitched(stitcher.stitch(plan, rootRows));
        } catch (QueryExecutionException e) {
            IncludeFailure failure = IncludeFailure.of(e);
            if (settings.strictIncludes()) {
                log.error("Include stitch failed on {} (strict): {}", entity, e.getMessage(), e);
                return new IncludeOutcome.Aborted(failure, settings.debug());
            }
            log.warn("Include stitch failed on {}, returning {} root rows without includes: {}",
                    entity, rootRows.size(), e.getMessage());
            if (settings.debug()) {
                log.debug("Include stitch failure detail", e);
            }
            return new IncludeOutcome.PartiallyStitched(rootRows, failure, settings.debug());
        }
    }
}
