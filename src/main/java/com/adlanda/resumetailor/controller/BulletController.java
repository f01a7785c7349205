package com.adlanda.resumetailor.controller;

import com.adlanda.resumetailor.model.BulletRequest;
import com.adlanda.resumetailor.model.BulletResponse;
import com.adlanda.resumetailor.service.BulletService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.adlanda.resumetailor.controller.ResumeController.USER_HEADER;

/**
 * REST controller for the bullet library.
 */
@RestController
@RequestMapping("/api/v1")
public class BulletController {

    private final BulletService bulletService;

    public BulletController(BulletService bulletService) {
        this.bulletService = bulletService;
    }

    @PostMapping("/experiences/{experienceId}/bullets")
    public ResponseEntity<BulletResponse> create(@RequestHeader(USER_HEADER) String userId,
                                                 @PathVariable String experienceId,
                                                 @Valid @RequestBody BulletRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BulletResponse.from(bulletService.createBullet(userId, experienceId, request)));
    }

    @GetMapping("/experiences/{experienceId}/bullets")
    public ResponseEntity<List<BulletResponse>> list(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String experienceId) {
        return ResponseEntity.ok(bulletService.listBullets(userId, experienceId).stream()
                .map(BulletResponse::from)
                .toList());
    }

    @PutMapping("/bullets/{id}")
    public ResponseEntity<BulletResponse> update(@RequestHeader(USER_HEADER) String userId,
                                                 @PathVariable String id,
                                                 @Valid @RequestBody BulletRequest request) {
        return ResponseEntity.ok(BulletResponse.from(bulletService.updateBullet(userId, id, request)));
    }

    /**
     * Deletes a bullet and drops it from every resume selection.
     */
    @DeleteMapping("/bullets/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        bulletService.deleteBullet(userId, id);
        return ResponseEntity.noContent().build();
    }
}
