package org.pxboard.access;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ConfigPermissionEvaluatorTest {

    private final ConfigPermissionEvaluator evaluator = new ConfigPermissionEvaluator(ConfigFactory.parseString(
        "anonymous = [\"boards.list\"]\n"
            + "authenticated = [\"boards.pixels.post\"]\n"
            + "users { \"root.admin\" = [\"boards.post\"] }"));

    @Test
    void anonymousPermissionsApplyToEveryone() {
        assertThat(evaluator.hasPermission(null, Permission.BOARDS_LIST)).isTrue();
        assertThat(evaluator.hasPermission(new Identity("alice"), Permission.BOARDS_LIST)).isTrue();
    }

    @Test
    void authenticatedPermissionsNeedAnIdentity() {
        assertThat(evaluator.hasPermission(null, Permission.BOARDS_PIXELS_POST)).isFalse();
        assertThat(evaluator.hasPermission(new Identity("alice"), Permission.BOARDS_PIXELS_POST)).isTrue();
    }

    @Test
    void userPermissionsAreIndividual() {
        assertThat(evaluator.hasPermission(new Identity("root.admin"), Permission.BOARDS_POST)).isTrue();
        assertThat(evaluator.hasPermission(new Identity("alice"), Permission.BOARDS_POST)).isFalse();
    }

    @Test
    void unknownPermissionKeyIsRejected() {
        assertThatThrownBy(() -> new ConfigPermissionEvaluator(ConfigFactory.parseString("anonymous = [\"boards.burn\"]")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("boards.burn");
    }
}
