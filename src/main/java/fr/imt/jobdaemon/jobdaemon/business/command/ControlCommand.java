package fr.imt.jobdaemon.jobdaemon.business.command;

/**
 * A control request bound to its arguments. The result becomes the {@code data} of the response.
 */
@FunctionalInterface
public interface ControlCommand {

    Object execute();

}
