/**
 * YAML configuration and the factories that turn it into runtime objects.
 */
package com.loglens.core.config;
