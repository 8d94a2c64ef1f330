package airdev.devserver.builtins;

import airdev.devserver.model.StdApiRequest;

import java.util.List;

/**
 * Runs builtin functions locally through a separate executable.
 */
public interface BuiltinClient {

    /**
     * Command line that executes one builtin request.
     *
     * @throws BuiltinUnavailableException if builtins cannot run here
     */
    List<String> command(StdApiRequest request);
}
