package com.scholary.acquisition.gateway;

/**
 * The gateway's verdict on one requested file. {@code error} is null when the file was enqueued.
 */
public record SubmittedFile(String filename, long size, String error) {

  public static SubmittedFile accepted(String filename, long size) {
    return new SubmittedFile(filename, size, null);
  }

  public static SubmittedFile failed(String filename, long size, String error) {
    return new SubmittedFile(filename, size, error);
  }

  public boolean isAccepted() {
    return error == null;
  }
}
