package pass;

import driver.Config;
import exception.DecompileException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.Pass.ASTPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Runs the structuring passes over one unit. Prelude passes run once; the
 * fixpoint passes are repeated in order until a whole round reports no
 * progress, the iteration limit is reached, or a stop is requested.
 */
public class PassManager implements AutoCloseable {
    private final List<ASTPass> prelude = new ArrayList<>();
    private final List<ASTPass> fixpoint = new ArrayList<>();

    private final Set<String> enabled;
    private final PassContext context;
    private final int maxIterations;
    private final long timeBudgetMs;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private int iterations = 0;

    public PassManager(PassContext context) {
        this(context, Config.getInstance().maxIterations, Config.getInstance().timeBudgetMs);
    }

    public PassManager(PassContext context, int maxIterations, long timeBudgetMs) {
        this.context = context;
        this.maxIterations = maxIterations;
        this.timeBudgetMs = timeBudgetMs;
        // read the system property
        // eg: -Dast.passes=deadstmtelim,loopRefine,...
        this.enabled = loadEnabled("ast.passes");
        setDefaultPipeline();
    }

    /**
     * Default pipeline: debug names first, then cleanup and the two
     * structuring passes until nothing changes.
     */
    private void setDefaultPipeline() {
        setPrelude(
                ASTPassType.StructFieldRenamer);

        setFixpointPipeline(
                ASTPassType.DeadStmtElim,
                ASTPassType.ReachBasedRefine,
                ASTPassType.LoopRefine);
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    @SuppressWarnings("unchecked")
    public <T extends ASTPass> T getPass(Class<T> cls) {
        for (ASTPass p : prelude) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }
        for (ASTPass p : fixpoint) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }
        throw new DecompileException("can not get the pass: " + cls.getName());
    }

    /**
     * Run the prelude once, then the fixpoint passes until no pass reports
     * progress.
     * @return whether any pass changed the unit
     */
    public boolean run() {
        LoggingManager.setUnit(context.getUnit().getName());
        long deadline = timeBudgetMs > 0 ? System.currentTimeMillis() + timeBudgetMs : Long.MAX_VALUE;
        boolean changed = false;

        for (ASTPass p : prelude) {
            changed |= runPass(p);
        }

        iterations = 0;
        boolean progress = true;
        while (progress && !context.getStopSignal().isRequested()) {
            if (maxIterations > 0 && iterations >= maxIterations) {
                log.warn("no fixpoint after {} iterations, leaving the rest unstructured", iterations);
                break;
            }
            iterations++;
            progress = false;
            for (ASTPass p : fixpoint) {
                if (System.currentTimeMillis() > deadline) {
                    log.warn("time budget of {} ms used up, stopping", timeBudgetMs);
                    p.stop();
                    break;
                }
                progress |= runPass(p);
            }
            changed |= progress;
        }

        log.info("structuring finished after {} iteration(s){}", iterations,
                context.getStopSignal().isRequested() ? " (stopped)" : "");
        return changed;
    }

    private boolean runPass(ASTPass p) {
        boolean progress = p.run();
        if (Config.getInstance().isDebug) {
            log.info("[AST] " + p.getType().getName() + (progress ? " changed the unit" : ""));
        }
        return progress;
    }

    /** Ask the running pipeline to wind down after the current node. */
    public void stop() {
        context.getStopSignal().request();
    }

    public int getIterations() {
        return iterations;
    }

    public List<ASTPass> getPipeline() {
        List<ASTPass> all = new ArrayList<>(prelude);
        all.addAll(fixpoint);
        return Collections.unmodifiableList(all);
    }

    /**
     * 按顺序整体设置 prelude（会清空重建）
     */
    public void setPrelude(ASTPassType... types) {
        replace(prelude, types);
    }

    /**
     * 按顺序整体设置 fixpoint pipeline（会清空重建）
     */
    public void setFixpointPipeline(ASTPassType... types) {
        replace(fixpoint, types);
    }

    /**
     * 追加一个已经构造好的 pass，测试与外部驱动用
     */
    public void addFixpointPass(ASTPass pass) {
        fixpoint.add(pass);
    }

    private void replace(List<ASTPass> pipeline, ASTPassType... types) {
        closeAll(pipeline);
        pipeline.clear();
        for (ASTPassType type : types) {
            if (enabled.isEmpty() || enabled.contains(type.getName())) {
                pipeline.add(type.create(context));
            }
        }
    }

    private static void closeAll(List<ASTPass> pipeline) {
        for (ASTPass p : pipeline) {
            p.close();
        }
    }

    @Override
    public void close() {
        closeAll(prelude);
        closeAll(fixpoint);
    }
}
