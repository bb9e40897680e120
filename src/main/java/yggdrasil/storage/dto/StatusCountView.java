package yggdrasil.storage.dto;

import yggdrasil.storage.model.RecordStatus;

public interface StatusCountView {

    RecordStatus getStatus();

    Long getTotal();
}
