package org.strata.migration;

import org.strata.migration.contributor.DdlContributor;
import org.strata.migration.contributor.PostCreateContributor;
import org.strata.migration.contributor.TableBodyContributor;
import org.strata.migration.contributor.create.ColumnContributor;
import org.strata.migration.contributor.create.ForeignKeyContributor;
import org.strata.migration.contributor.create.IndexContributor;
import org.strata.migration.dialect.Dialect;
import org.strata.model.TableModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles a {@code CREATE TABLE} statement plus its follow-up statements from
 * contributors, ordered by priority.
 */
public class CreateTableBuilder {
    private final String table;
    private final Dialect dialect;
    private final List<TableBodyContributor> body = new ArrayList<>();
    private final List<PostCreateContributor> post = new ArrayList<>();

    public CreateTableBuilder(String table, Dialect dialect) {
        this.table = table;
        this.dialect = dialect;
    }

    public <T extends DdlContributor> CreateTableBuilder add(T c) {
        if (c instanceof TableBodyContributor bodyContributor) {
            body.add(bodyContributor);
        } else if (c instanceof PostCreateContributor postContributor) {
            post.add(postContributor);
        } else {
            throw new IllegalArgumentException("Unsupported contributor type: " + c.getClass().getName());
        }
        return this;
    }

    /**
     * @return the create statement first, followed by post-create statements
     */
    public List<String> build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);
        sb.append(dialect.closeCreateTable());

        List<String> statements = new ArrayList<>();
        statements.add(sb.toString());
        post.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(statements, dialect));
        return statements;
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1) sb.delete(last, last + 2);
    }

    /**
     * Columns, primary key, foreign keys and (unless {@code withIndexes} is false) indexes
     * of {@code definition}. Shadow tables are created without indexes and, where
     * constraint names are schema-global, without foreign key names.
     */
    public CreateTableBuilder defaultsFrom(TableModel definition, boolean withIndexes, boolean namedForeignKeys) {
        this.add(new ColumnContributor(definition.getPrimaryKeyColumns(), definition.getColumns()));
        this.add(new ForeignKeyContributor(definition.getForeignKeys(), namedForeignKeys));
        if (withIndexes) {
            this.add(new IndexContributor(table, definition.getIndexes()));
        }
        return this;
    }
}
