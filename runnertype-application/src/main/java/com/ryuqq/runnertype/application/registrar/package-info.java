/**
 * Startup registration entry surface.
 *
 * <p>{@link com.ryuqq.runnertype.application.registrar.RunnerTypeRegistrar} is invoked once
 * during system startup. Catalog source, store configuration and logging setup are
 * supplied by the implementation's wiring.</p>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.application.registrar;
