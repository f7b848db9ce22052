package io.backup4j;

import io.backup4j.core.EngineResult;

/**
 * One prepared engine call. The controller methods may be invoked from other threads while
 * {@link #execute()} is blocking.
 */
public interface EngineOperation extends EngineController {

    EngineResult execute() throws Exception;
}
