package org.iceforge.cloudstorage.upload.strategy;

import org.iceforge.cloudstorage.upload.MultipartUploadCoordinator;
import org.iceforge.cloudstorage.upload.PartRange;
import org.iceforge.cloudstorage.upload.UploadSession;
import org.springframework.stereotype.Service;

@Service
public class MultipartUploadStrategy extends CoordinatedUploadStrategy {

    public MultipartUploadStrategy(MultipartUploadCoordinator coordinator) {
        super(coordinator);
    }

    @Override
    public Kind kind() {
        return Kind.MULTIPART;
    }

    @Override
    protected void uploadParts(UploadSession session) {
        for (PartRange part : session.plan()) {
            coordinator.uploadPart(session, part);
        }
    }
}
