/**
 * Runner type definition validation.
 *
 * <p>{@link com.ryuqq.runnertype.core.validation.RunnerTypeDefinitionValidator} checks the shape
 * of one definition at a time and reports every violation in a single
 * {@link com.ryuqq.runnertype.core.validation.ValidationException}, so catalog authors get
 * precise, attributable errors.</p>
 *
 * @since 1.0.0
 * @author Runner Type Registry Team
 */
package com.ryuqq.runnertype.core.validation;
