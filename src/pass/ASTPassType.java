package pass;

import java.util.function.Function;
import pass.ASTPass.DeadStmtElimPass;
import pass.ASTPass.LoopRefinePass;
import pass.ASTPass.ReachBasedRefinePass;
import pass.ASTPass.StructFieldRenamerPass;
import pass.Pass.ASTPass;

/**
 * ASTPassFactory: create the ASTPass here
 */
public enum ASTPassType implements PassType<ASTPass> {
    StructFieldRenamer(StructFieldRenamerPass::new),
    DeadStmtElim(DeadStmtElimPass::new),
    ReachBasedRefine(ReachBasedRefinePass::new),
    LoopRefine(LoopRefinePass::new),
    // add more astpass here
    ;

    private final Function<PassContext, ASTPass> factory;

    ASTPassType(Function<PassContext, ASTPass> constructor) {
        this.factory = constructor;
    }

    @Override
    public Function<PassContext, ASTPass> constructor() {
        return factory;
    }
}
