package io.malicki.retrycommander.exception;

import io.malicki.retrycommander.kafka.errorhandling.ErrorCategory;
import io.malicki.retrycommander.kafka.hook.HookPoint;
import lombok.Getter;

@Getter
public class HookException extends RetryCommanderException {

    private final HookPoint hookPoint;
    private final String hookName;

    public HookException(HookPoint hookPoint, String hookName, Throwable cause) {
        super(ErrorCategory.HOOK, "Hook " + hookName + " failed in " + hookPoint + ": " + cause.getMessage(), cause);
        this.hookPoint = hookPoint;
        this.hookName = hookName;
    }
}
