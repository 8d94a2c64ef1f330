package airdev.devserver.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Who the server acts as: the logged-in user and team, either of which may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthInfo(
        @JsonProperty("user") User user,
        @JsonProperty("team") Team team) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("id") String id,
            @JsonProperty("email") String email,
            @JsonProperty("name") String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name) {
    }

    public static AuthInfo anonymous() {
        return new AuthInfo(null, null);
    }

    public String userId() {
        return user == null ? "" : nullToEmpty(user.id());
    }

    public String userEmail() {
        return user == null ? "" : nullToEmpty(user.email());
    }

    public String userName() {
        return user == null ? "" : nullToEmpty(user.name());
    }

    public String teamId() {
        return team == null ? "" : nullToEmpty(team.id());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
