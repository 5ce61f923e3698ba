/** Evaluation of syntax trees against a whitelist of constructors. */
package io.dataeval.eval;
