/**
 * Declarative event expressions: filters, group keys and value extractors.
 *
 * <p>
 * Configuration supplies expressions as text; {@link com.loglens.core.expression.ExpressionEvaluator}
 * compiles them into serializable functions over {@link com.loglens.core.model.LogEvent}.
 * The default grammar only reads event attributes and literals.
 * </p>
 */
package com.loglens.core.expression;
