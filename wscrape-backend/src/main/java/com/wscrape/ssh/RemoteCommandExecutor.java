package com.wscrape.ssh;

/**
 * Runs the status command on the remote host.
 */
public interface RemoteCommandExecutor {

    /**
     * Run the command and return everything it wrote to stdout.
     *
     * @return raw command output
     * @throws RemoteCommandException if the session is unusable or the channel fails
     */
    String execute() throws RemoteCommandException;
}
