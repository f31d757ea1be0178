package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.config.StorageSettings;
import dev.totis.s3sim.exception.StorageException;

@FunctionalInterface
public interface FacadeFactory {
  StorageFacade open(StorageSettings settings) throws StorageException;
}
