/**
 * Runner type catalog package.
 *
 * <p>A catalog supplies the canonical, ordered list of runner type definitions.
 * It never validates and never mutates its definitions.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.runnertype.core.catalog.BuiltinRunnerTypeCatalog} - Runner types shipped with the system</li>
 *   <li>{@link com.ryuqq.runnertype.core.catalog.StaticRunnerTypeCatalog} - Caller-supplied list</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.core.catalog;
