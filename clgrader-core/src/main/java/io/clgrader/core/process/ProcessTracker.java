package io.clgrader.core.process;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Registry of in-flight processes, so shutdown can kill all of them at once.
///
/// @implNote **Thread-safe**.
public class ProcessTracker {

    private static final Logger logger = Logger.getLogger(ProcessTracker.class.getName());

    private final Set<LaunchedProcess> running = ConcurrentHashMap.newKeySet();

    public void register(LaunchedProcess process) {
        running.add(process);
    }

    public void unregister(LaunchedProcess process) {
        running.remove(process);
    }

    public int size() {
        return running.size();
    }

    /// Kills every tracked process tree.
    ///
    /// @return the number of trees killed
    public int destroyAll() {
        int killed = 0;
        for (LaunchedProcess process : running) {
            process.destroyTree();
            running.remove(process);
            killed++;
        }
        if (killed > 0) {
            logger.warning("Killed " + killed + " in-flight process tree(s)");
        }
        return killed;
    }
}
