package com.splitttr.editor.api.dto;

import java.util.UUID;

public class TransferRequest {
  public UUID newOwnerId;
}
