package org.strata.migration.contributor.create;

import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.dialect.Dialect;
import org.strata.model.ColumnModel;

import java.util.List;

public record ColumnContributor(List<String> pkColumns, List<ColumnModel> columns) implements TableBodyContributor {
    @Override
    public int priority() {
        return 40; // Column 정의
    }

    @Override
    public void contribute(StringBuilder sb, Dialect dialect) {
        for (ColumnModel c : columns) {
            sb.append("  ").append(dialect.getColumnDefinitionSql(c, pkColumns)).append(",\n");
        }
        // 단일 auto-increment PK는 컬럼 정의에 인라인으로 들어가므로 테이블 레벨 PK를 생략
        if (pkColumns != null && !pkColumns.isEmpty() && !dialect.isInlinePrimaryKey(columns, pkColumns)) {
            sb.append("  ").append(dialect.getPrimaryKeyDefinitionSql(pkColumns)).append(",\n");
        }
    }
}
