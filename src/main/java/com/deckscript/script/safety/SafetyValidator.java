package com.deckscript.script.safety;

/**
 * Static gate run once per snippet before extraction. A negative verdict means no call is
 * extracted or dispatched for that snippet.
 */
public interface SafetyValidator {
    SafetyVerdict check(String code);
}
