package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import org.strata.cli.service.SessionFactory;
import org.strata.migration.error.GraphException;
import org.strata.migration.error.LockException;
import org.strata.migration.error.MigrationException;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Opens a session from the shared options, runs the command and maps failures to exit codes.
 */
abstract class MigrationCommand implements Callable<Integer> {

    @CommandLine.Mixin
    protected ConnectionOptions options = new ConnectionOptions();

    @Override
    public Integer call() {
        try (MigrationSession session = new SessionFactory().open(options)) {
            return run(session);
        } catch (GraphException e) {
            System.err.println("Version graph error: " + e.getMessage());
            return ExitCodes.GRAPH_ERROR;
        } catch (LockException e) {
            System.err.println(e.getMessage());
            System.err.println("   If no other run is active, clear it with 'strata unlock'.");
            return ExitCodes.LOCK_HELD;
        } catch (MigrationException | IllegalArgumentException e) {
            System.err.println(failurePrefix() + e.getMessage());
            return ExitCodes.FAILURE;
        } catch (Exception e) {
            System.err.println(failurePrefix() + e.getMessage());
            e.printStackTrace();
            return ExitCodes.FAILURE;
        }
    }

    protected abstract int run(MigrationSession session);

    protected String failurePrefix() {
        return "Command failed: ";
    }
}
