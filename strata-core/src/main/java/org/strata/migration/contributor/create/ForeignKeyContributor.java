package org.strata.migration.contributor.create;

import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.dialect.Dialect;
import org.strata.model.ForeignKeyModel;

import java.util.List;

public record ForeignKeyContributor(List<ForeignKeyModel> foreignKeys, boolean named) implements TableBodyContributor {
    @Override
    public int priority() {
        return 50; // FK는 컬럼/PK 다음
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        for (ForeignKeyModel fk : foreignKeys) {
            ForeignKeyModel rendered = named ? fk : fk.toBuilder().name(null).build();
            sb.append("  ").append(dialect.getForeignKeyDefinitionSql(rendered)).append(",\n");
        }
    }
}
