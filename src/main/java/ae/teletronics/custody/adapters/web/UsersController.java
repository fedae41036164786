package ae.teletronics.custody.adapters.web;

import ae.teletronics.custody.adapters.web.dto.BanRequest;
import ae.teletronics.custody.adapters.web.dto.UserDto;
import ae.teletronics.custody.application.UserAccountService;
import ae.teletronics.custody.application.exceptions.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping
public class UsersController {

    private final UserAccountService users;

    public UsersController(UserAccountService users) {
        this.users = users;
    }

    /** First contact: registers the caller if unknown and returns the stored profile. */
    @PostMapping(path = "/users/me", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserDto> me(@RequestHeader(FilesController.USER_ID) String userId,
                            @RequestHeader(value = FilesController.USER_NAME, required = false) String userName) {
        return users.requireActiveUser(userId, null, userName).map(UserDto::from);
    }

    @GetMapping(path = "/users/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserDto> get(@RequestHeader(FilesController.USER_ID) String userId,
                             @PathVariable String id) {
        return users.requireActiveUser(userId, null, null)
                .then(users.findUser(id))
                .map(UserDto::from);
    }

    @PutMapping(path = "/admin/users/{id}/ban", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> setBanned(@RequestHeader(FilesController.USER_ID) String actorId,
                                @PathVariable String id,
                                @RequestBody BanRequest body) {
        if (body == null || body.banned() == null) {
            return Mono.error(new ValidationException("banned is required"));
        }
        return users.setBanned(actorId, id, body.banned());
    }
}
