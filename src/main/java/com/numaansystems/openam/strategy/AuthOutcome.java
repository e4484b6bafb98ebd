package com.numaansystems.openam.strategy;

/**
 * Result of one authentication attempt.
 *
 * @param <U> the application's user type
 */
public final class AuthOutcome<U> {

    public enum Type {
        REDIRECT,
        SUCCESS,
        FAIL,
        ERROR
    }

    private final Type type;
    private final String location;
    private final U user;
    private final Object info;
    private final Throwable cause;

    private AuthOutcome(Type type, String location, U user, Object info, Throwable cause) {
        this.type = type;
        this.location = location;
        this.user = user;
        this.info = info;
        this.cause = cause;
    }

    public static <U> AuthOutcome<U> redirect(String location) {
        return new AuthOutcome<>(Type.REDIRECT, location, null, null, null);
    }

    public static <U> AuthOutcome<U> success(U user, Object info) {
        return new AuthOutcome<>(Type.SUCCESS, null, user, info, null);
    }

    public static <U> AuthOutcome<U> fail(Object info) {
        return new AuthOutcome<>(Type.FAIL, null, null, info, null);
    }

    public static <U> AuthOutcome<U> error(Throwable cause) {
        return new AuthOutcome<>(Type.ERROR, null, null, null, cause);
    }

    public Type getType() {
        return type;
    }

    public String getLocation() {
        return location;
    }

    public U getUser() {
        return user;
    }

    public Object getInfo() {
        return info;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return switch (type) {
            case REDIRECT -> "AuthOutcome{REDIRECT " + location + "}";
            case SUCCESS -> "AuthOutcome{SUCCESS " + user + "}";
            case FAIL -> "AuthOutcome{FAIL " + info + "}";
            case ERROR -> "AuthOutcome{ERROR " + cause + "}";
        };
    }
}
