package org.strata.migration.contributor.create;

import org.strata.migration.contributor.PostCreateContributor;
import org.strata.migration.dialect.Dialect;
import org.strata.model.IndexModel;

import java.util.List;

public record IndexContributor(String table, List<IndexModel> indexes) implements PostCreateContributor {
    @Override
    public int priority() {
        return 60; // Index 생성
    }

    @Override
    public void contribute(List<String> statements, Dialect dialect) {
        for (IndexModel idx : indexes) {
            statements.add(dialect.getCreateIndexSql(idx.ownedBy(table)));
        }
    }
}
