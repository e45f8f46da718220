package org.strata.migration.operation;

public interface OperationVisitor<R> {
    R visitAddColumn(AddColumn op);
    R visitDropColumn(DropColumn op);
    R visitRenameColumn(RenameColumn op);
    R visitAlterColumn(AlterColumn op);
    R visitCreateTable(CreateTable op);
    R visitDropTable(DropTable op);
    R visitAddForeignKey(AddForeignKey op);
    R visitDropForeignKey(DropForeignKey op);
    R visitRebuildTable(RebuildTable op);
    R visitCreateIndex(CreateIndex op);
    R visitDropIndex(DropIndex op);
    R visitExecuteSql(ExecuteSql op);
}
