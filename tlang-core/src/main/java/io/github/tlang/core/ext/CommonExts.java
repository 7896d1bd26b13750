package io.github.tlang.core.ext;

import io.github.tlang.core.ir.Stmt;
import io.github.tlang.core.ir.StmtList;

public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The {@link StmtList} a statement is an element of. Set by the list only.
     */
    public static final Ext<StmtList> OWNING_LIST = Ext.create(StmtList.class, "OWNING_LIST");
    /**
     * The {@link Stmt} a nested block belongs to, e.g. the branch of an if.
     */
    public static final Ext<Stmt> OWNING_STMT = Ext.create(Stmt.class, "OWNING_STMT");
}
