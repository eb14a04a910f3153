/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2025 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.signpost;

import io.signpost.routing.DuplicateRuleException;
import io.signpost.routing.NotFoundException;
import io.signpost.routing.RuleSyntaxException;
import io.signpost.routing.WebsocketMismatchException;
import io.signpost.routing.converter.ValidationException;
import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

import java.util.List;
import java.util.Set;

/**
 * Exception messages. Ids 1 to 4999.
 */
@MessageBundle(projectCode = "SIGNPOST")
public interface SignpostMessages {

    SignpostMessages MESSAGES = Messages.getBundle(SignpostMessages.class);

    @Message(id = 1, value = "Rule '%s' must start with a leading slash")
    RuleSyntaxException ruleMustStartWithSlash(String rule);

    @Message(id = 2, value = "Malformed rule '%s' at position %d")
    RuleSyntaxException malformedRule(String rule, int position);

    @Message(id = 3, value = "Variable name '%s' used twice in rule '%s'")
    RuleSyntaxException variableUsedTwice(String variable, String rule);

    @Message(id = 4, value = "No converter named '%s' for rule '%s'")
    RuleSyntaxException unknownConverter(String converter, String rule);

    @Message(id = 5, value = "Invalid arguments for converter '%s' in rule '%s'")
    RuleSyntaxException invalidConverterArguments(String converter, String rule, @Cause Throwable cause);

    @Message(id = 6, value = "WebSocket rule '%s' can only use 'GET', 'HEAD', and 'OPTIONS' methods")
    RuleSyntaxException websocketRuleMethods(String rule);

    @Message(id = 7, value = "Rule '%s' for endpoint '%s' has the same pattern and methods as rule '%s' for endpoint '%s'")
    DuplicateRuleException duplicateRule(String rule, String endpoint, String existingRule, String existingEndpoint);

    @Message(id = 8, value = "Host matching and subdomain matching cannot both be enabled")
    IllegalArgumentException hostAndSubdomainMatching();

    @Message(id = 9, value = "A subdomain cannot be bound when host matching is enabled")
    IllegalArgumentException subdomainWithHostMatching();

    @Message(id = 10, value = "Rule '%s' names the subdomain '%s' but subdomain matching is disabled")
    RuleSyntaxException subdomainMatchingDisabled(String rule, String subdomain);

    @Message(id = 11, value = "Rule '%s' names the host '%s' but host matching is disabled")
    RuleSyntaxException hostMatchingDisabled(String rule, String host);

    @Message(id = 12, value = "Invalid converter arguments '%s' at position %d")
    IllegalArgumentException invalidConverterArgumentSyntax(String arguments, int position);

    @Message(id = 13, value = "Converter '%s' does not accept the argument '%s'")
    IllegalArgumentException unexpectedConverterArgument(String converter, String argument);

    @Message(id = 14, value = "Converter argument '%s' must be %s but was '%s'")
    IllegalArgumentException converterArgumentType(String argument, String type, Object value);

    @Message(id = 15, value = "Could not build url for endpoint '%s'.")
    String couldNotBuildUrl(String endpoint);

    @Message(id = 16, value = "Detected invalid alias setting, no canonical URL found for '%s'")
    IllegalStateException noCanonicalUrlForAlias(String url);

    @Message(id = 18, value = "Rule '%s' has neither an endpoint nor a redirect target")
    RuleSyntaxException ruleWithoutEndpoint(String rule);

    @Message(id = 19, value = "The regular expression of converter '%s' in rule '%s' is invalid")
    RuleSyntaxException invalidConverterRegex(String converter, String rule, @Cause Throwable cause);

    @Message(id = 20, value = "Unsupported charset %s")
    IllegalArgumentException unsupportedCharset(String charset);

    @Message(id = 21, value = "No value for variable '%s' of the redirect target '%s'")
    IllegalStateException missingRedirectVariable(String variable, String redirectTo);

    @Message(id = 22, value = "No value for placeholder '%s' in rule template '%s'")
    IllegalArgumentException missingTemplateVariable(String placeholder, String template);

    @Message(id = 23, value = "No rule matches the requested URL")
    NotFoundException notFound();

    @Message(id = 24, value = "The requested URL is only available for a different kind of request")
    WebsocketMismatchException websocketMismatch();

    @Message(id = 25, value = "Value of variable '%s' cannot be used for the redirect target '%s'")
    IllegalStateException invalidRedirectValue(String variable, String redirectTo, @Cause Throwable cause);

    @Message(id = 26, value = "Could not build url for endpoint '%s' with method '%s'.")
    String couldNotBuildUrlWithMethod(String endpoint, String method);

    @Message(id = 27, value = "Could not build url for endpoint '%s' and values %s.")
    String couldNotBuildUrlWithValues(String endpoint, Set<String> values);

    @Message(id = 28, value = "Could not build url for endpoint '%s' with method '%s' and values %s.")
    String couldNotBuildUrlWithMethodAndValues(String endpoint, String method, Set<String> values);

    @Message(value = "Did you mean to use methods %s?")
    String suggestMethods(Set<String> methods);

    @Message(value = "Did you forget to specify values %s?")
    String suggestMissingValues(List<String> missing);

    @Message(value = "Did you mean '%s' instead?")
    String suggestEndpoint(String endpoint);

    @Message(id = 29, value = "Method not allowed, allowed methods are %s")
    String methodNotAllowed(Set<String> allowedMethods);

    @Message(id = 30, value = "Redirect to %s")
    String redirectRequired(String newUrl);

    @Message(id = 31, value = "'%s' is not one of %s")
    ValidationException valueNotAllowed(String value, List<String> items);

    @Message(id = 32, value = "Value %s is out of range")
    ValidationException valueOutOfRange(String value);

    @Message(id = 33, value = "Not a finite number: %s")
    ValidationException notAFiniteNumber(Object value);

    @Message(id = 34, value = "Not a number: %s")
    ValidationException notANumber(Object value);

    @Message(id = 35, value = "Expected %d digits but got %s")
    ValidationException wrongDigitCount(int expected, String value);

    @Message(id = 36, value = "Not an integer: %s")
    ValidationException notAnInteger(Object value);
}
