package com.wscrape.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Credentials read from a local JSON file, for example:
 *
 * <pre>{"user": "myusername", "pass": "mypassword"}</pre>
 */
@Value
public class Login {
    String user;
    String pass;

    @JsonCreator
    public Login(@JsonProperty(value = "user", required = true) String user,
                 @JsonProperty(value = "pass", required = true) String pass) {
        this.user = user;
        this.pass = pass;
    }

    @Override
    public String toString() {
        return "Login(user=" + user + ", pass=***)";
    }
}
