package org.esa.echogram.cli;

/**
 * A sub-command of the echogram command line.
 */
public interface CliCommand {

    /**
     * @return the exit code, 0 on success
     */
    int run();
}
